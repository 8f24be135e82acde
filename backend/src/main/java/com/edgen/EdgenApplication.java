package com.edgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EdgenApplication {
    public static void main(String[] args) {
        SpringApplication.run(EdgenApplication.class, args);
    }
}
