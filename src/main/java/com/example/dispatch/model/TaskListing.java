package com.example.dispatch.model;

import lombok.Value;

import java.util.List;

@Value
public class TaskListing {
    List<ClassListing> classes;  // 按优先级升序
    int total;

    @Value
    public static class ClassListing {
        int priority;
        String label;
        int count;
        List<Entry> tasks;       // 队列中的先后顺序
    }

    @Value
    public static class Entry {
        int index;               // 从 1 开始
        String name;
        String preview;          // 截断后的描述
    }
}
