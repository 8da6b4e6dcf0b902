package com.example.ordersync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Order Sync Service.
 */
@SpringBootApplication
public class OrderSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(OrderSyncApplication.class, args);
    }
}
