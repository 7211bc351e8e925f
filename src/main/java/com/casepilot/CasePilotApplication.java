package com.casepilot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CasePilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(CasePilotApplication.class, args);
    }
}
