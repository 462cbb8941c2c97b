package com.metabolic.lumping;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LumpGemApplication {

    public static void main(String[] args) {
        SpringApplication.run(LumpGemApplication.class, args);
    }
}
