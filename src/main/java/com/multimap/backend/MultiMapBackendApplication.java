package com.multimap.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MultiMapBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(MultiMapBackendApplication.class, args);
    }
}
