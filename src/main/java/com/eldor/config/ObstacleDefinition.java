package com.eldor.config;

/**
 * Scenery placed on the map: a blocking obstacle (trees, boulders) or a purely decorative object.
 */
public record ObstacleDefinition(
        int x,
        int y,
        String name,
        boolean blocking
) {}
