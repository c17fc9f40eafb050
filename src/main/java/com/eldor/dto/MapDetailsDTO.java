package com.eldor.dto;

import com.eldor.model.GameMap;
import com.eldor.model.MapTile;
import com.eldor.model.TerrainType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * DTO describing the current state of a live map.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MapDetailsDTO {

    private String id;
    private String name;
    private String description;
    private int width;
    private int height;
    private Map<TerrainType, Integer> terrainCounts;
    private int coastalTiles;
    private int blockedTiles;
    private List<MapObjectDTO> objects;

    public static MapDetailsDTO fromMap(String mapId, GameMap map) {
        Map<TerrainType, Integer> terrainCounts = new EnumMap<>(TerrainType.class);
        int coastal = 0;
        int blocked = 0;
        for (int x = 0; x < map.getWidth(); x++) {
            for (int y = 0; y < map.getHeight(); y++) {
                MapTile tile = map.getTile(x, y);
                terrainCounts.merge(tile.getTerrain(), 1, Integer::sum);
                if (tile.isCoastal()) {
                    coastal++;
                }
                if (tile.isBlocked()) {
                    blocked++;
                }
            }
        }

        return MapDetailsDTO.builder()
                .id(mapId)
                .name(map.getName())
                .description(map.getDescription())
                .width(map.getWidth())
                .height(map.getHeight())
                .terrainCounts(terrainCounts)
                .coastalTiles(coastal)
                .blockedTiles(blocked)
                .objects(map.getAllObjects().stream().map(MapObjectDTO::fromObject).toList())
                .build();
    }
}
