package com.eldor.config;

/**
 * A creature dwelling placed on the map.
 */
public record DwellingDefinition(
        int x,
        int y,
        int creatureId,
        int initialCount,
        int weeklyGrowth,
        String name
) {}
