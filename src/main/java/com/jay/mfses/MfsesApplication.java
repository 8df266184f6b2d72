package com.jay.mfses;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MfsesApplication {
    public static void main(String[] args) {
        SpringApplication.run(MfsesApplication.class, args);
    }
}
