package com.rugradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Watches Solana for new Pump.fun launches and logs a rug-pull risk report for each.
 * Set {@code SOLANA_RPC} to use a dedicated RPC provider.
 */
@SpringBootApplication
public class RugRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(RugRadarApplication.class, args);
    }
}
