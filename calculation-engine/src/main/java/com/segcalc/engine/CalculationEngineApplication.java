package com.segcalc.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CalculationEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalculationEngineApplication.class, args);
    }
}
