package com.example.dispatch.exception;

import java.util.Set;

/**
 * 提交的任务优先级不在管理器识别的范围内。
 * 管理器状态不受影响，调用方可以改正优先级后重试。
 */
public class InvalidPriorityClassException extends RuntimeException {

    private final int priority;
    private final Set<Integer> recognizedClasses;

    public InvalidPriorityClassException(int priority, Set<Integer> recognizedClasses) {
        super("Invalid priority (" + priority + ")");
        this.priority = priority;
        this.recognizedClasses = recognizedClasses;
    }

    public int getPriority() {
        return priority;
    }

    public Set<Integer> getRecognizedClasses() {
        return recognizedClasses;
    }
}
