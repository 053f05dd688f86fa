package com.example.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmissionResult {
    private boolean success;
    private String message;
    private Task task;     // 提交成功时为入队的任务，失败时为 null

    public static SubmissionResult accepted(Task task) {
        return new SubmissionResult(true,
                "Task '" + task.getName() + "' added with priority " + task.getPriority(), task);
    }

    public static SubmissionResult rejected(String message) {
        return new SubmissionResult(false, message, null);
    }
}
