package com.fleetgate.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.ComponentScan;

/**
 * FleetGate application entry point.
 */
@SpringBootApplication
@ComponentScan(basePackages = "com.fleetgate")
public class FleetGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetGateApplication.class, args);
    }
}
