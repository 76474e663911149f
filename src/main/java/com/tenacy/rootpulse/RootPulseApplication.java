package com.tenacy.rootpulse;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class RootPulseApplication {

    public static void main(String[] args) {
        SpringApplication.run(RootPulseApplication.class, args);
    }
}
