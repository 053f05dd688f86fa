package com.example.dispatch.config;

import com.example.dispatch.queue.PriorityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

@Configuration
@Slf4j
public class DispatcherConfig {

    @Value("${dispatcher.priority-classes:1,2,3}")
    private String priorityClasses;

    @Value("${dispatcher.listing.preview-length:50}")
    private int previewLength;

    @Bean
    public PriorityManager priorityManager() {
        List<Integer> classes = parsePriorityClasses(priorityClasses);
        log.info("任务管理器已创建，识别的优先级: {}，描述预览长度: {}", classes, previewLength);
        return new PriorityManager(classes, previewLength);
    }

    /**
     * 解析逗号分隔的优先级配置，例如 "1,2,3"
     */
    static List<Integer> parsePriorityClasses(String value) {
        List<Integer> classes = new ArrayList<>();
        if (value == null) {
            return classes;
        }
        for (String part : value.split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                classes.add(Integer.parseInt(trimmed));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("dispatcher.priority-classes 格式错误: " + value, e);
            }
        }
        return classes;
    }
}
