package com.example.astro;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AstroApplication {

    public static void main(String[] args) {
        SpringApplication.run(AstroApplication.class, args);
    }
}
