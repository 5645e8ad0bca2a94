package com.llmrelay.relay_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RelayBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(RelayBackendApplication.class, args);
    }
}
