package com.flagship.restaurant_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class RestaurantLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(RestaurantLedgerApplication.class, args);
    }
}
