package com.stackrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for StackRelay - quota-aware dispatch layer for the Stack Exchange API.
 */
@SpringBootApplication
@EnableScheduling
public class StackRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(StackRelayApplication.class, args);
    }
}
