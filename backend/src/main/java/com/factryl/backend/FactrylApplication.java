package com.factryl.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FactrylApplication {

    public static void main(String[] args) {
        SpringApplication.run(FactrylApplication.class, args);
    }
}
