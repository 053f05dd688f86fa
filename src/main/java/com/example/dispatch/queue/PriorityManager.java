package com.example.dispatch.queue;

import com.example.dispatch.exception.InvalidPriorityClassException;
import com.example.dispatch.model.Task;
import com.example.dispatch.model.TaskListing;
import com.example.dispatch.model.TaskPriority;
import com.example.dispatch.model.TaskStatistics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 严格优先级的任务管理器。
 * <p>
 * 每个识别的优先级对应一个 {@link ClassQueue}，优先级集合在构造时确定。
 * 数值越小优先级越高；同一优先级内先进先出；不同优先级之间严格按数值升序，
 * 没有老化或公平性调整。
 * <p>
 * 所有操作都在管理器自身的锁内完成，"按升序扫描并取出第一个非空队列的队首"
 * 是一个整体，两个并发的 next() 不会拿到同一个任务。
 */
public class PriorityManager {

    public static final int DEFAULT_PREVIEW_LENGTH = 50;
    public static final String ELLIPSIS = "...";

    private final NavigableMap<Integer, ClassQueue> queues = new TreeMap<>();
    private final int previewLength;

    public PriorityManager(Collection<Integer> priorityClasses) {
        this(priorityClasses, DEFAULT_PREVIEW_LENGTH);
    }

    public PriorityManager(Collection<Integer> priorityClasses, int previewLength) {
        if (priorityClasses == null || priorityClasses.isEmpty()) {
            throw new IllegalArgumentException("At least one priority class is required");
        }
        if (previewLength <= 0) {
            throw new IllegalArgumentException("Preview length must be positive: " + previewLength);
        }
        for (Integer priority : priorityClasses) {
            if (priority == null || priority <= 0) {
                throw new IllegalArgumentException("Priority class must be a positive integer: " + priority);
            }
            queues.putIfAbsent(priority, new ClassQueue());
        }
        this.previewLength = previewLength;
    }

    /**
     * 高、中、低三个优先级的默认配置
     */
    public static PriorityManager withDefaultClasses() {
        List<Integer> classes = new ArrayList<>();
        for (TaskPriority priority : TaskPriority.values()) {
            classes.add(priority.getLevel());
        }
        return new PriorityManager(classes);
    }

    /**
     * 识别的优先级，升序
     */
    public Set<Integer> getPriorityClasses() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(queues.keySet()));
    }

    /**
     * 把任务放入对应优先级的队尾
     *
     * @throws InvalidPriorityClassException 优先级不在识别范围内，任务不会被保存
     */
    public synchronized void submit(Task task) {
        ClassQueue queue = queues.get(task.getPriority());
        if (queue == null) {
            throw new InvalidPriorityClassException(task.getPriority(), getPriorityClasses());
        }
        queue.enqueue(task);
    }

    /**
     * 取出下一个任务；没有待处理任务时返回 empty
     */
    public synchronized Optional<Task> next() {
        for (ClassQueue queue : queues.values()) {
            if (!queue.isEmpty()) {
                return queue.dequeue();
            }
        }
        return Optional.empty();
    }

    /**
     * 与 next() 选择相同的任务，但不取出
     */
    public synchronized Optional<Task> peekNext() {
        for (ClassQueue queue : queues.values()) {
            if (!queue.isEmpty()) {
                return queue.peek();
            }
        }
        return Optional.empty();
    }

    public synchronized int size() {
        int total = 0;
        for (ClassQueue queue : queues.values()) {
            total += queue.size();
        }
        return total;
    }

    public synchronized TaskStatistics statistics() {
        Map<Integer, Integer> perClass = new LinkedHashMap<>();
        int total = 0;
        for (Map.Entry<Integer, ClassQueue> entry : queues.entrySet()) {
            int count = entry.getValue().size();
            perClass.put(entry.getKey(), count);
            total += count;
        }
        return new TaskStatistics(total, Collections.unmodifiableMap(perClass));
    }

    /**
     * 按优先级升序列出所有任务，只读遍历
     */
    public synchronized TaskListing listAll() {
        List<TaskListing.ClassListing> classes = new ArrayList<>();
        int total = 0;
        for (Map.Entry<Integer, ClassQueue> entry : queues.entrySet()) {
            List<Task> tasks = entry.getValue().snapshot();
            List<TaskListing.Entry> entries = new ArrayList<>(tasks.size());
            for (int i = 0; i < tasks.size(); i++) {
                Task task = tasks.get(i);
                entries.add(new TaskListing.Entry(i + 1, task.getName(), preview(task.getDescription())));
            }
            classes.add(new TaskListing.ClassListing(entry.getKey(), TaskPriority.labelOf(entry.getKey()),
                    tasks.size(), Collections.unmodifiableList(entries)));
            total += tasks.size();
        }
        return new TaskListing(Collections.unmodifiableList(classes), total);
    }

    String preview(String description) {
        if (description == null) {
            return "";
        }
        // 按字符（码点）截断，避免拆开代理对
        if (description.codePointCount(0, description.length()) <= previewLength) {
            return description;
        }
        return description.substring(0, description.offsetByCodePoints(0, previewLength)) + ELLIPSIS;
    }
}
