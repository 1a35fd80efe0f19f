package com.example.inboxsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MessagingSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(MessagingSyncApplication.class, args);
    }
}
