package com.restaurant.simulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DataSimulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DataSimulatorApplication.class, args);
    }
}
