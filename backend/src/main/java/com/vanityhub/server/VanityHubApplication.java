package com.vanityhub.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VanityHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(VanityHubApplication.class, args);
    }
}
