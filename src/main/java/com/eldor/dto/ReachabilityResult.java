package com.eldor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of relocating or removing objects that heroes cannot reach.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReachabilityResult {

    private int totalReachableTiles;
    private int totalUnreachableObjects;
    private int objectsRelocated;
    private int objectsRemoved;
}
