package com.solarcharge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableCaching
@EnableScheduling
public class SolarChargeApplication {

    public static void main(String[] args) {
        SpringApplication.run(SolarChargeApplication.class, args);
    }
}
