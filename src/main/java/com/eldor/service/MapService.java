package com.eldor.service;

import com.eldor.config.MapDefinition;
import com.eldor.config.MapLoader;
import com.eldor.config.TerrainRegionDefinition;
import com.eldor.model.GameMap;
import com.eldor.model.MapObject;
import com.eldor.model.Position;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds {@link GameMap} instances from {@link MapDefinition}s and keeps one live map per
 * definition id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MapService {

    private final MapLoader mapLoader;
    private final MapObjectFactory objectFactory;

    private final Map<String, GameMap> liveMaps = new ConcurrentHashMap<>();

    /**
     * The live map for a definition, built on first access.
     *
     * @throws IllegalArgumentException if the map id is unknown
     */
    public GameMap getMap(String mapId) {
        return liveMaps.computeIfAbsent(mapId, id -> buildMap(mapLoader.getMap(id)));
    }

    public MapDefinition getDefinition(String mapId) {
        return mapLoader.getMap(mapId);
    }

    public List<MapDefinition> getAvailableMaps() {
        return mapLoader.getAvailableMaps();
    }

    /**
     * Discards the live map and rebuilds it from its definition.
     */
    public GameMap resetMap(String mapId) {
        GameMap rebuilt = buildMap(mapLoader.getMap(mapId));
        liveMaps.put(mapId, rebuilt);
        log.info("Map '{}' reset", mapId);
        return rebuilt;
    }

    /**
     * Paints terrain, places every object and computes coastal tiles.
     *
     * @throws IllegalArgumentException if the size is not positive or an object is malformed
     * @throws IndexOutOfBoundsException if an object lies outside the map
     */
    public GameMap buildMap(MapDefinition def) {
        log.info("Building map '{}' ({}x{})", def.name(), def.width(), def.height());
        GameMap map = new GameMap(def.width(), def.height(), def.name());
        map.setDescription(def.description() != null ? def.description() : "");

        if (def.defaultTerrain() != map.getTile(0, 0).getTerrain()) {
            for (int x = 0; x < def.width(); x++) {
                for (int y = 0; y < def.height(); y++) {
                    map.setTerrain(new Position(x, y), def.defaultTerrain());
                }
            }
        }

        for (TerrainRegionDefinition region : def.terrain()) {
            for (Position pos : region.positions()) {
                if (map.isInBounds(pos)) {
                    map.setTerrain(pos, region.terrain());
                } else {
                    log.warn("Terrain region {} of map '{}' extends past the map edge at {}",
                            region.terrain(), def.id(), pos);
                }
            }
        }
        map.calculateCoastalTiles();

        def.resources().forEach(r -> place(map, objectFactory.createResource(r)));
        def.mines().forEach(m -> place(map, objectFactory.createMine(m)));
        def.dwellings().forEach(d -> place(map, objectFactory.createDwelling(d)));
        def.obstacles().forEach(o -> place(map, objectFactory.createObstacle(o)));

        log.info("Map '{}' built with {} objects", def.name(), map.getObjectCount());
        return map;
    }

    private void place(GameMap map, MapObject obj) {
        int id = map.addObject(obj);
        log.debug("Placed {} as #{}", obj, id);
    }
}
