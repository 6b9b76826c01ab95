package com.chamapool.chama;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Chama Service Application
 *
 * Runs rotating savings groups: membership, periodic contributions, punishments,
 * member governance and the payout rotation.
 */
@SpringBootApplication
public class ChamaServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChamaServiceApplication.class, args);
    }
}
