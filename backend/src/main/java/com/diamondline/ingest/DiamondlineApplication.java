package com.diamondline.ingest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class DiamondlineApplication {
    public static void main(String[] args) {
        SpringApplication.run(DiamondlineApplication.class, args);
    }
}
