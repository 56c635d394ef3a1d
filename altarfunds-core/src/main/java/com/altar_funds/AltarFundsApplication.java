package com.altar_funds;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AltarFundsApplication {

    public static void main(String[] args) {
        SpringApplication.run(AltarFundsApplication.class, args);
    }
}
