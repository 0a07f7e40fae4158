package com.rozet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RozetApplication {

    public static void main(String[] args) {
        SpringApplication.run(RozetApplication.class, args);
    }
}
