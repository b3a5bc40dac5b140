package com.example.UniScout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class UniScoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(UniScoutApplication.class, args);
    }
}
