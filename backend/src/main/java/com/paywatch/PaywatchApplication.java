package com.paywatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PaywatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaywatchApplication.class, args);
    }
}
