package com.harmoniq.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HarmoniqApplication {

    public static void main(String[] args) {
        SpringApplication.run(HarmoniqApplication.class, args);
    }
}
