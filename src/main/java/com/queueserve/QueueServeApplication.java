package com.queueserve;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class QueueServeApplication {

    public static void main(String[] args) {
        SpringApplication.run(QueueServeApplication.class, args);
    }
}
