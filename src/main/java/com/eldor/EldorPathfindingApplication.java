package com.eldor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Realms of Eldor adventure map service.
 *
 * Features:
 * - Adventure maps loaded from JSON definitions
 * - A* hero pathfinding with terrain costs
 * - Reachable-area and map reachability queries over REST
 */
@SpringBootApplication
public class EldorPathfindingApplication {

    public static void main(String[] args) {
        SpringApplication.run(EldorPathfindingApplication.class, args);
    }
}
