package com.pricelens.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PriceEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(PriceEngineApplication.class, args);
    }
}
