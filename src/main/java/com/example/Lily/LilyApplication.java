package com.example.Lily;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LilyApplication {

    public static void main(String[] args) {
        SpringApplication.run(LilyApplication.class, args);
    }
}
