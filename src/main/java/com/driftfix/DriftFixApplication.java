package com.driftfix;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DriftFixApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftFixApplication.class, args);
    }
}
