package com.lexsched.lexsched_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LexschedApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(LexschedApiApplication.class, args);
    }
}
