package com.purchasingpower.forge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ForgeCopilotApplication {

    public static void main(String[] args) {
        SpringApplication.run(ForgeCopilotApplication.class, args);
    }
}
