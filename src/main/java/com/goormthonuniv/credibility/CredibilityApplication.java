package com.goormthonuniv.credibility;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CredibilityApplication {

    public static void main(String[] args) {
        SpringApplication.run(CredibilityApplication.class, args);
    }
}
