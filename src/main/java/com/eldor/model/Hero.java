package com.eldor.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A hero moving across the adventure map with a per-turn movement allowance.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Hero {

    private String name;

    @Builder.Default
    private PlayerColor owner = PlayerColor.NEUTRAL;

    private Position position;

    private int movementPoints;

    public boolean canMove() {
        return movementPoints > 0;
    }
}
