package com.lynkvertx.expower;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * EXPOWER - Expander Power-Generation Skid Calculation Engine
 * Main application entry point
 */
@SpringBootApplication
public class ExpowerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ExpowerApplication.class, args);
    }
}
