package com.example.apitest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ApiTestEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApiTestEngineApplication.class, args);
    }
}
