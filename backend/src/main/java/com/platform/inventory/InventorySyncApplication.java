package com.platform.inventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Instance Inventory Sync
 * 
 * Keeps the local inventory of provisioned compute instances consistent
 * with what each provider reports:
 * - Detects instances recorded locally that the provider no longer has
 * - Removes them and their port mappings, one isolated transaction each
 * - Runs on a schedule or on demand through the REST API
 */
@SpringBootApplication
@EnableScheduling
public class InventorySyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventorySyncApplication.class, args);
    }
}
