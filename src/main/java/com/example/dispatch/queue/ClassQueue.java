package com.example.dispatch.queue;

import com.example.dispatch.model.Task;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * 同一优先级任务的先进先出队列。
 * 不做同步，由持有它的 PriorityManager 负责互斥。
 */
public class ClassQueue {

    private final Deque<Task> tasks = new ArrayDeque<>();

    /**
     * 追加到队尾
     */
    public void enqueue(Task task) {
        tasks.addLast(task);
    }

    /**
     * 取出队首任务，队列为空时返回 empty
     */
    public Optional<Task> dequeue() {
        return Optional.ofNullable(tasks.pollFirst());
    }

    /**
     * 查看队首任务但不取出
     */
    public Optional<Task> peek() {
        return Optional.ofNullable(tasks.peekFirst());
    }

    public boolean isEmpty() {
        return tasks.isEmpty();
    }

    public int size() {
        return tasks.size();
    }

    /**
     * 按入队顺序返回当前任务的快照，修改快照不影响队列
     */
    public List<Task> snapshot() {
        return new ArrayList<>(tasks);
    }
}
