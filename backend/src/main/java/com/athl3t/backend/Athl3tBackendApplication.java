package com.athl3t.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Athl3tBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(Athl3tBackendApplication.class, args);
    }
}
