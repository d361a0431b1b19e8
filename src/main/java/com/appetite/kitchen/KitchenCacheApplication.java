package com.appetite.kitchen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KitchenCacheApplication {
    public static void main(String[] args) {
        SpringApplication.run(KitchenCacheApplication.class, args);
    }
}
