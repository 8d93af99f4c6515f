package com.geico.poc.cargoquery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CargoQueryApplication {

    public static void main(String[] args) {
        SpringApplication.run(CargoQueryApplication.class, args);
    }
}
