package com.example.dispatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 待分发的任务，创建后不可修改。
 * 优先级在这里不做校验，由 PriorityManager 在提交时判断。
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Task {
    String name;         // 任务名称（不要求唯一）
    String description;  // 任务描述
    int priority;        // 优先级，数值越小越先处理

    public static Task of(String name, String description, int priority) {
        return new Task(name, description, priority);
    }

    public String getPriorityLabel() {
        return TaskPriority.labelOf(priority);
    }

    @Override
    public String toString() {
        return "Task: " + name + " (Priority: " + getPriorityLabel() + ")\n"
                + "Description: " + description;
    }
}
