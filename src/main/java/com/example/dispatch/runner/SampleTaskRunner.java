package com.example.dispatch.runner;

import com.example.dispatch.model.Task;
import com.example.dispatch.service.TaskDispatchService;
import com.example.dispatch.service.TaskListingFormatter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 启动时演示任务分发流程，只通过 TaskDispatchService 的公开操作完成。
 * 设置 dispatcher.demo.enabled=true 开启。
 */
@Component
@ConditionalOnProperty(name = "dispatcher.demo.enabled", havingValue = "true")
@Slf4j
public class SampleTaskRunner implements CommandLineRunner {

    static final int TASKS_TO_PROCESS = 5;

    @Autowired
    private TaskDispatchService dispatchService;

    @Autowired
    private TaskListingFormatter listingFormatter;

    static List<Task> sampleTasks() {
        return Arrays.asList(
                Task.of("Fix critical bug", "The login system is failing for some users", 1),
                Task.of("Update documentation", "Update the API documentation with the new endpoints", 2),
                Task.of("Optimize SQL query", "The reporting query is far too slow", 1),
                Task.of("Add new icons", "Add the icons for the new theme", 3),
                Task.of("Review pull requests", "Review the team's pending pull requests", 2),
                Task.of("Fix typos", "Fix typos in the user interface", 3),
                Task.of("Investigate security issue", "Check the reported possible vulnerability", 1),
                Task.of("Implement dark mode", "Add support for a dark theme", 2)
        );
    }

    @Override
    public void run(String... args) {
        log.info("添加示例任务...");
        for (Task task : sampleTasks()) {
            dispatchService.submit(task);
        }

        log.info("统计:\n{}", listingFormatter.formatStatistics(dispatchService.statistics()));
        log.info("\n{}", listingFormatter.formatListing(dispatchService.listAll()));

        log.info("按优先级处理任务:");
        for (int i = 0; i < TASKS_TO_PROCESS; i++) {
            Optional<Task> task = dispatchService.next();
            task.ifPresent(t -> log.info("执行:\n{}", t));
        }

        log.info("更新后的统计:\n{}", listingFormatter.formatStatistics(dispatchService.statistics()));
        log.info("\n{}", listingFormatter.formatListing(dispatchService.listAll()));
    }
}
