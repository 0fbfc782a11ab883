package com.guildpool.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Guildpool Platform API Application
 *
 * Group membership, verification, distrust voting and reward distribution.
 */
@SpringBootApplication(scanBasePackages = "com.guildpool")
public class GuildpoolApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(GuildpoolApiApplication.class, args);
    }
}
