package com.eldor.dto;

import com.eldor.model.Position;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Answer to a path query. {@code positions} is empty and {@code cost} 0 when no path was found.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PathDTO {

    private String mapId;
    private Position from;
    private Position to;
    private boolean found;
    private List<Position> positions;
    private int steps;
    private int cost;

    public static PathDTO of(String mapId, Position from, Position to, List<Position> path, int cost) {
        boolean found = path != null;
        return PathDTO.builder()
                .mapId(mapId)
                .from(from)
                .to(to)
                .found(found)
                .positions(found ? List.copyOf(path) : List.of())
                .steps(found ? path.size() - 1 : 0)
                .cost(found ? cost : 0)
                .build();
    }
}
