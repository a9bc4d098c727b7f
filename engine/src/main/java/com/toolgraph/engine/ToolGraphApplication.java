package com.toolgraph.engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ToolGraphApplication {

    public static void main(String[] args) {
        SpringApplication.run(ToolGraphApplication.class, args);
    }
}
