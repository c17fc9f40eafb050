package com.eldor.config;

import com.eldor.model.Position;
import com.eldor.model.TerrainType;

import java.util.List;

/**
 * Root definition of an adventure map, loaded from a JSON file.
 *
 * @param id             unique slug, e.g. "green-valley"
 * @param name           human-readable name
 * @param description    short description of the map
 * @param author         map author / credit
 * @param width          tiles per row
 * @param height         tiles per column
 * @param defaultTerrain terrain of every tile not covered by a region, grass when omitted
 * @param terrain        rectangular terrain regions, applied in order
 * @param resources      resource piles
 * @param mines          mines
 * @param dwellings      creature dwellings
 * @param obstacles      scenery, blocking or decorative
 * @param heroSpawns     starting tiles used for reachability checks
 */
public record MapDefinition(
        String id,
        String name,
        String description,
        String author,
        int width,
        int height,
        TerrainType defaultTerrain,
        List<TerrainRegionDefinition> terrain,
        List<ResourceDefinition> resources,
        List<MineDefinition> mines,
        List<DwellingDefinition> dwellings,
        List<ObstacleDefinition> obstacles,
        List<Position> heroSpawns
) {

    public MapDefinition {
        defaultTerrain = defaultTerrain != null ? defaultTerrain : TerrainType.GRASS;
        terrain = terrain != null ? List.copyOf(terrain) : List.of();
        resources = resources != null ? List.copyOf(resources) : List.of();
        mines = mines != null ? List.copyOf(mines) : List.of();
        dwellings = dwellings != null ? List.copyOf(dwellings) : List.of();
        obstacles = obstacles != null ? List.copyOf(obstacles) : List.of();
        heroSpawns = heroSpawns != null ? List.copyOf(heroSpawns) : List.of();
    }

    public int objectCount() {
        return resources.size() + mines.size() + dwellings.size() + obstacles.size();
    }
}
