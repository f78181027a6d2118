package com.parlayarchitect;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ParlayArchitectApplication {

    public static void main(String[] args) {
        SpringApplication.run(ParlayArchitectApplication.class, args);
    }
}
