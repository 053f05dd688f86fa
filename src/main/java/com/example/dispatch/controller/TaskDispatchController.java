package com.example.dispatch.controller;

import com.example.dispatch.model.SubmissionResult;
import com.example.dispatch.model.Task;
import com.example.dispatch.model.TaskListing;
import com.example.dispatch.model.TaskStatistics;
import com.example.dispatch.model.TaskSubmission;
import com.example.dispatch.service.TaskDispatchService;
import com.example.dispatch.service.TaskListingFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/tasks")
@Slf4j
public class TaskDispatchController {

    @Autowired
    private TaskDispatchService dispatchService;

    @Autowired
    private TaskListingFormatter listingFormatter;

    /**
     * 提交任务
     */
    @PostMapping
    public ResponseEntity<SubmissionResult> submit(@RequestBody TaskSubmission submission) {
        log.info("收到提交任务请求: {}", submission);

        try {
            SubmissionResult result = dispatchService.submit(
                    submission.getName(), submission.getDescription(), submission.getPriority());

            if (result.isSuccess()) {
                return ResponseEntity.ok(result);
            }
            return ResponseEntity.badRequest().body(result);
        } catch (Exception e) {
            log.error("提交任务失败", e);
            return ResponseEntity.badRequest()
                    .body(SubmissionResult.rejected("Failed to submit task: " + e.getMessage()));
        }
    }

    /**
     * 取出下一个任务，没有任务时返回 204
     */
    @PostMapping("/next")
    public ResponseEntity<Task> next() {
        try {
            return dispatchService.next()
                    .map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.noContent().build());
        } catch (Exception e) {
            log.error("取出任务失败", e);
            return ResponseEntity.badRequest().build();
        }
    }

    /**
     * 查看下一个任务
     */
    @GetMapping("/next")
    public ResponseEntity<Task> peekNext() {
        try {
            return dispatchService.peekNext()
                    .map(ResponseEntity::ok)
                    .orElseGet(() -> ResponseEntity.noContent().build());
        } catch (Exception e) {
            log.error("查看下一个任务失败", e);
            return ResponseEntity.badRequest().build();
        }
    }

    @GetMapping("/statistics")
    public ResponseEntity<TaskStatistics> statistics() {
        try {
            return ResponseEntity.ok(dispatchService.statistics());
        } catch (Exception e) {
            log.error("获取任务统计失败", e);
            return ResponseEntity.badRequest().build();
        }
    }

    @GetMapping
    public ResponseEntity<TaskListing> listAll() {
        try {
            return ResponseEntity.ok(dispatchService.listAll());
        } catch (Exception e) {
            log.error("获取任务列表失败", e);
            return ResponseEntity.badRequest().build();
        }
    }

    /**
     * 纯文本格式的任务列表
     */
    @GetMapping(value = "/listing", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> listing() {
        try {
            return ResponseEntity.ok(listingFormatter.formatListing(dispatchService.listAll()));
        } catch (Exception e) {
            log.error("生成任务列表失败", e);
            return ResponseEntity.badRequest().build();
        }
    }
}
