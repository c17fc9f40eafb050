package com.eldor.dto;

import com.eldor.model.Hero;
import com.eldor.model.PlayerColor;
import com.eldor.model.Position;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO asking whether a hero can reach a tile this turn.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class HeroMoveRequest {

    private String heroName;

    private PlayerColor owner;

    @NotNull(message = "Hero position is required")
    private Position position;

    @Min(value = 0, message = "Movement points must not be negative")
    private int movementPoints;

    @NotNull(message = "Target is required")
    private Position target;

    public Hero toHero() {
        return Hero.builder()
                .name(heroName)
                .owner(owner != null ? owner : PlayerColor.NEUTRAL)
                .position(position)
                .movementPoints(movementPoints)
                .build();
    }
}
