package com.flagship.pos_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PosEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PosEngineApplication.class, args);
    }
}
