package com.example.dispatch.model;

import lombok.Value;

import java.util.Map;

/**
 * 某一时刻的队列统计。perClass 按优先级升序，包含数量为 0 的优先级。
 */
@Value
public class TaskStatistics {
    int total;
    Map<Integer, Integer> perClass;
}
