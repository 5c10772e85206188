package com.example.verifierfrontend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VerifierFrontendApplication {

    public static void main(String[] args) {
        SpringApplication.run(VerifierFrontendApplication.class, args);
    }

}
