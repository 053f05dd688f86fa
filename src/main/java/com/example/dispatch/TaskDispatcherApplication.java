package com.example.dispatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TaskDispatcherApplication {
    public static void main(String[] args) {
        SpringApplication.run(TaskDispatcherApplication.class, args);
    }
}
