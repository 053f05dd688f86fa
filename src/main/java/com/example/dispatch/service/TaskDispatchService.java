package com.example.dispatch.service;

import com.example.dispatch.exception.InvalidPriorityClassException;
import com.example.dispatch.model.SubmissionResult;
import com.example.dispatch.model.Task;
import com.example.dispatch.model.TaskListing;
import com.example.dispatch.model.TaskStatistics;
import com.example.dispatch.queue.PriorityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
@Slf4j
public class TaskDispatchService {

    public static final String INVALID_PRIORITY = "INVALID_PRIORITY";
    public static final String INVALID_TASK = "INVALID_TASK";

    @Autowired
    private PriorityManager priorityManager;

    @Autowired
    private NotificationService notificationService;

    /**
     * 提交任务
     */
    public SubmissionResult submit(String name, String description, Integer priority) {
        if (name == null || name.trim().isEmpty()) {
            log.warn("拒绝提交: 任务名称为空");
            notificationService.sendErrorNotification(INVALID_TASK, "Task name must not be empty");
            return SubmissionResult.rejected("Task name must not be empty");
        }
        if (priority == null) {
            log.warn("拒绝提交: 任务 {} 没有优先级", name);
            notificationService.sendErrorNotification(INVALID_TASK, "Task priority is required");
            return SubmissionResult.rejected("Task priority is required");
        }
        return submit(Task.of(name, description, priority));
    }

    public SubmissionResult submit(Task task) {
        try {
            priorityManager.submit(task);
        } catch (InvalidPriorityClassException e) {
            log.warn("拒绝提交任务 {}: 优先级 {} 无效，可用优先级: {}",
                    task.getName(), e.getPriority(), e.getRecognizedClasses());
            notificationService.sendErrorNotification(INVALID_PRIORITY, e.getMessage());
            return SubmissionResult.rejected(e.getMessage());
        }

        SubmissionResult result = SubmissionResult.accepted(task);
        log.info("任务已提交: {}, 优先级: {}", task.getName(), task.getPriority());
        notificationService.notifyTaskSubmitted(task, result.getMessage());
        return result;
    }

    /**
     * 取出下一个要执行的任务
     */
    public Optional<Task> next() {
        Optional<Task> task = priorityManager.next();
        if (task.isPresent()) {
            log.info("分发任务: {}, 优先级: {}, 剩余: {}",
                    task.get().getName(), task.get().getPriority(), priorityManager.size());
            notificationService.notifyTaskDispatched(task.get());
        } else {
            log.info("没有待处理的任务");
        }
        return task;
    }

    /**
     * 查看下一个任务但不取出
     */
    public Optional<Task> peekNext() {
        Optional<Task> task = priorityManager.peekNext();
        log.debug("查看下一个任务: {}", task.map(Task::getName).orElse("<无>"));
        return task;
    }

    public TaskStatistics statistics() {
        return priorityManager.statistics();
    }

    public TaskListing listAll() {
        TaskListing listing = priorityManager.listAll();
        log.debug("列出全部任务，共 {} 个", listing.getTotal());
        return listing;
    }
}
