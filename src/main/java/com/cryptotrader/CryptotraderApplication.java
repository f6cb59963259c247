package com.cryptotrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CryptotraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(CryptotraderApplication.class, args);
    }
}
