package com.eldor.config;

import com.eldor.model.Position;
import com.eldor.model.TerrainType;

import java.util.ArrayList;
import java.util.List;

/**
 * A rectangle of tiles painted with one terrain. Width and height default to a single tile.
 */
public record TerrainRegionDefinition(
        TerrainType terrain,
        int x,
        int y,
        int width,
        int height
) {

    public List<Position> positions() {
        int w = Math.max(width, 1);
        int h = Math.max(height, 1);
        List<Position> positions = new ArrayList<>(w * h);
        for (int dx = 0; dx < w; dx++) {
            for (int dy = 0; dy < h; dy++) {
                positions.add(new Position(x + dx, y + dy));
            }
        }
        return positions;
    }
}
