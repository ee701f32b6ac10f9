package com.example.memocache;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MemoCacheApplication {

    public static void main(String[] args) {
        SpringApplication.run(MemoCacheApplication.class, args);
    }
}
