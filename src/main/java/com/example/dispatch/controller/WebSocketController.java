package com.example.dispatch.controller;

import com.example.dispatch.model.SubmissionResult;
import com.example.dispatch.model.Task;
import com.example.dispatch.model.TaskSubmission;
import com.example.dispatch.service.TaskDispatchService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.handler.annotation.SendTo;
import org.springframework.stereotype.Controller;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Controller
@Slf4j
public class WebSocketController {

    @Autowired
    private TaskDispatchService dispatchService;

    /**
     * 通过WebSocket提交任务
     */
    @MessageMapping("/submit")
    @SendTo("/topic/submission-results")
    public SubmissionResult handleSubmit(@Payload TaskSubmission submission) {
        log.info("通过WebSocket收到提交请求: {}", submission);

        try {
            return dispatchService.submit(
                    submission.getName(), submission.getDescription(), submission.getPriority());
        } catch (Exception e) {
            log.error("处理提交请求失败", e);
            return SubmissionResult.rejected("Failed to submit task: " + e.getMessage());
        }
    }

    /**
     * 通过WebSocket取出下一个任务
     */
    @MessageMapping("/next")
    @SendTo("/topic/dispatched")
    public Map<String, Object> handleNext() {
        Map<String, Object> response = new HashMap<>();

        try {
            Optional<Task> task = dispatchService.next();
            response.put("empty", !task.isPresent());
            task.ifPresent(t -> response.put("task", t));
            if (!task.isPresent()) {
                response.put("message", "No pending tasks");
            }
        } catch (Exception e) {
            log.error("处理取出任务请求失败", e);
            response.put("success", false);
            response.put("message", "Failed to dispatch task: " + e.getMessage());
        }
        response.put("timestamp", System.currentTimeMillis());
        return response;
    }
}
