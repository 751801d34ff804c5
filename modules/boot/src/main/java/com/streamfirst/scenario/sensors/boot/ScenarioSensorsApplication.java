package com.streamfirst.scenario.sensors.boot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ScenarioSensorsApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScenarioSensorsApplication.class, args);
    }
}
