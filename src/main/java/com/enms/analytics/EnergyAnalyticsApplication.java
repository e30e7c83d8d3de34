package com.enms.analytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class EnergyAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnergyAnalyticsApplication.class, args);
    }
}
