package com.williamcallahan.statuteindex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class StatuteIndexApplication {

    public static void main(String[] args) {
        SpringApplication.run(StatuteIndexApplication.class, args);
    }

}
