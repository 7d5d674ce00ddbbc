package com.creatorradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CreatorRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreatorRadarApplication.class, args);
    }
}
