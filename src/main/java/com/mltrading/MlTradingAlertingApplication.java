package com.mltrading;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MlTradingAlertingApplication {

    public static void main(String[] args) {
        SpringApplication.run(MlTradingAlertingApplication.class, args);
    }
}
