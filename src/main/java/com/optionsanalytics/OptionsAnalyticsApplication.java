package com.optionsanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptionsAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptionsAnalyticsApplication.class, args);
    }
}
