package com.nosota.mescrow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MescrowApplication {
    public static void main(String[] args) {
        SpringApplication.run(MescrowApplication.class, args);
    }
}
