package com.vrfradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VrfRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(VrfRadarApplication.class, args);
    }
}
