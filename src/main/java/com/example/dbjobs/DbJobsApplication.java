package com.example.dbjobs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling // 开启定时任务支持，JobDispatcher 依赖它
public class DbJobsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DbJobsApplication.class, args);
    }
}
