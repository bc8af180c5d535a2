package com.launchradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LaunchRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(LaunchRadarApplication.class, args);
    }
}
