package com.planrunner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PlanRunnerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlanRunnerApplication.class, args);
    }
}
