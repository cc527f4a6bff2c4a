package com.example.usagemeter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class UsageMeterApplication {

    public static void main(String[] args) {
        SpringApplication.run(UsageMeterApplication.class, args);
    }
}
