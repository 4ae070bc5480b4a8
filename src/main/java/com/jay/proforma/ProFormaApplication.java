package com.jay.proforma;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProFormaApplication {
    public static void main(String[] args) {
        SpringApplication.run(ProFormaApplication.class, args);
    }
}
