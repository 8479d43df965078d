package com.myorg.olc.example;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OrderLifecycleApplication {
    public static void main(String[] args) {
        SpringApplication.run(OrderLifecycleApplication.class, args);
    }
}
