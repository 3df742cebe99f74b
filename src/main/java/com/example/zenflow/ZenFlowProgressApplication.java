package com.example.zenflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ZenFlowProgressApplication {

    public static void main(String[] args) {
        SpringApplication.run(ZenFlowProgressApplication.class, args);
    }
}
