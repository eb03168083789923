package com.skyt;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkytApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkytApplication.class, args);
    }
}
