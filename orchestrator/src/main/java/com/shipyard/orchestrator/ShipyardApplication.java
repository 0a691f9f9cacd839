package com.shipyard.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ShipyardApplication {

    public static void main(String[] args) {
        SpringApplication.run(ShipyardApplication.class, args);
    }
}
