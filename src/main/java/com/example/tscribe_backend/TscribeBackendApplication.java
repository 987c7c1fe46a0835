package com.example.tscribe_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class TscribeBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(TscribeBackendApplication.class, args);
    }
}
