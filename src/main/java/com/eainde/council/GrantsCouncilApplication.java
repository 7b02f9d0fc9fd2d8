package com.eainde.council;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GrantsCouncilApplication {

    public static void main(String[] args) {
        SpringApplication.run(GrantsCouncilApplication.class, args);
    }
}
