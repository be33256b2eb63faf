package com.chatdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChatdeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChatdeskApplication.class, args);
    }
}
