package com.foodrec;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FoodRecApplication {
    public static void main(String[] args) {
        SpringApplication.run(FoodRecApplication.class, args);
    }
}
