package com.genderai.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GenderApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(GenderApiApplication.class, args);
    }
}
