package com.eldor.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to a {@link HeroMoveRequest}, with the path the hero would take if one exists.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HeroMoveResult {

    private boolean reachable;
    private int movementPoints;
    private PathDTO path;
}
