package com.eldor.dto;

import com.eldor.model.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Tiles a hero can reach from {@code start} with {@code movementPoints} this turn.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReachableDTO {

    private String mapId;
    private Position start;
    private int movementPoints;
    private int count;
    private List<Position> positions;
}
