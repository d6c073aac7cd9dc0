package com.tencent.taskmgr;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Task Manager Application Entry Point
 *
 * @author taskmgr
 */
@SpringBootApplication(scanBasePackages = "com.tencent.taskmgr")
public class TaskManagerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TaskManagerApplication.class, args);
    }
}
