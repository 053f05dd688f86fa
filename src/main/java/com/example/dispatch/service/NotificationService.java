package com.example.dispatch.service;

import com.example.dispatch.model.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

/**
 * 通过 WebSocket 推送任务事件。推送失败只记录日志，不影响任务操作本身。
 */
@Service
@Slf4j
public class NotificationService {

    public static final String TOPIC_SUBMITTED = "/topic/task-submitted";
    public static final String TOPIC_DISPATCHED = "/topic/task-dispatched";
    public static final String TOPIC_ERRORS = "/topic/task-errors";

    @Autowired
    private SimpMessagingTemplate messagingTemplate;

    /**
     * 任务提交成功通知
     */
    public void notifyTaskSubmitted(Task task, String message) {
        try {
            Map<String, Object> event = new HashMap<>();
            event.put("type", "TASK_SUBMITTED");
            event.put("name", task.getName());
            event.put("priority", task.getPriority());
            event.put("message", message);
            event.put("timestamp", System.currentTimeMillis());

            messagingTemplate.convertAndSend(TOPIC_SUBMITTED, event);
            log.debug("发送任务提交通知: {}", task.getName());
        } catch (Exception e) {
            log.error("发送任务提交通知失败: {}", task.getName(), e);
        }
    }

    /**
     * 任务被取出分发的通知
     */
    public void notifyTaskDispatched(Task task) {
        try {
            messagingTemplate.convertAndSend(TOPIC_DISPATCHED, task);
            log.debug("发送任务分发通知: {}", task.getName());
        } catch (Exception e) {
            log.error("发送任务分发通知失败: {}", task.getName(), e);
        }
    }

    /**
     * 提交被拒绝的通知
     */
    public void sendErrorNotification(String type, String errorMessage) {
        try {
            Map<String, Object> error = new HashMap<>();
            error.put("type", type);
            error.put("message", errorMessage);
            error.put("timestamp", System.currentTimeMillis());

            messagingTemplate.convertAndSend(TOPIC_ERRORS, error);
            log.debug("发送错误通知: {}", errorMessage);
        } catch (Exception e) {
            log.error("发送错误通知失败", e);
        }
    }
}
