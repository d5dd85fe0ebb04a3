package com.multiangle;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MultiAngleApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultiAngleApplication.class, args);
    }
}
