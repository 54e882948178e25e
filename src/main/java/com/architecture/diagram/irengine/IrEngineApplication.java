package com.architecture.diagram.irengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IrEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(IrEngineApplication.class, args);
    }
}
