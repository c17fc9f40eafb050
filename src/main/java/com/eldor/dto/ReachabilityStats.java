package com.eldor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How much of a map heroes can actually walk to from their spawn points.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReachabilityStats {

    private int totalTiles;
    private int passableTiles;
    private int reachableTiles;
    private int unreachableTiles;
    private int totalObjects;
    private int unreachableObjects;

    /** Reachable share of passable tiles, 0.0 to 1.0. */
    private double reachabilityPercentage;
}
