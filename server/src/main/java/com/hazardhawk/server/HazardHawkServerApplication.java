package com.hazardhawk.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HazardHawkServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HazardHawkServerApplication.class, args);
    }
}
