package com.example.dispatch.service;

import com.example.dispatch.model.TaskListing;
import com.example.dispatch.model.TaskPriority;
import com.example.dispatch.model.TaskStatistics;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * 把任务列表和统计渲染成纯文本报告
 */
@Component
public class TaskListingFormatter {

    public String formatListing(TaskListing listing) {
        StringBuilder sb = new StringBuilder();
        sb.append("===== TASK LIST =====\n");

        for (TaskListing.ClassListing classListing : listing.getClasses()) {
            sb.append('\n')
                    .append("--- Priority ").append(classListing.getLabel().toUpperCase(Locale.ROOT))
                    .append(" (").append(classListing.getCount()).append(" tasks) ---\n");

            if (classListing.getTasks().isEmpty()) {
                sb.append("No tasks in this category\n");
                continue;
            }
            for (TaskListing.Entry entry : classListing.getTasks()) {
                sb.append(entry.getIndex()).append(". ")
                        .append(entry.getName()).append(" - ")
                        .append(entry.getPreview()).append('\n');
            }
        }

        sb.append('\n').append("Total: ").append(listing.getTotal()).append(" tasks\n");
        sb.append("=====================\n");
        return sb.toString();
    }

    public String formatStatistics(TaskStatistics statistics) {
        StringBuilder sb = new StringBuilder();
        sb.append("Total tasks: ").append(statistics.getTotal()).append('\n');
        for (Map.Entry<Integer, Integer> entry : statistics.getPerClass().entrySet()) {
            sb.append("Priority ").append(TaskPriority.labelOf(entry.getKey()))
                    .append(": ").append(entry.getValue()).append(" tasks\n");
        }
        return sb.toString();
    }
}
