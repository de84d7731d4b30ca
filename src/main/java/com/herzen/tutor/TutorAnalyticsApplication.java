package com.herzen.tutor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TutorAnalyticsApplication {
    public static void main(String[] args) {
        SpringApplication.run(TutorAnalyticsApplication.class, args);
    }
}
