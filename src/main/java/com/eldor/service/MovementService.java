package com.eldor.service;

import com.eldor.config.MapDefinition;
import com.eldor.dto.HeroMoveRequest;
import com.eldor.dto.HeroMoveResult;
import com.eldor.dto.MapDetailsDTO;
import com.eldor.dto.PathDTO;
import com.eldor.dto.ReachabilityStats;
import com.eldor.dto.ReachableDTO;
import com.eldor.model.GameMap;
import com.eldor.model.Hero;
import com.eldor.model.Position;
import com.eldor.pathfinding.Pathfinder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Movement queries against the live maps held by {@link MapService}.
 * <p>
 * Every query runs while holding the map's monitor, so a search never observes a map that
 * another request is rebuilding or editing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MovementService {

    private final MapService mapService;
    private final Pathfinder pathfinder;
    private final ReachabilityValidator reachabilityValidator;

    public PathDTO findPath(String mapId, Position from, Position to) {
        GameMap map = mapService.getMap(mapId);
        synchronized (map) {
            List<Position> path = pathfinder.findPath(map, from, to);
            int cost = pathfinder.calculatePathCost(map, path);
            log.debug("Path query on '{}' {} -> {}: {}", mapId, from, to,
                    path != null ? "cost " + cost : "no path");
            return PathDTO.of(mapId, from, to, path, cost);
        }
    }

    /**
     * Tiles reachable with the given budget. An off-map start or a budget that is not positive
     * reaches nothing.
     */
    public ReachableDTO getReachablePositions(String mapId, Position start, int movementPoints) {
        GameMap map = mapService.getMap(mapId);
        synchronized (map) {
            Set<Position> reachable = pathfinder.getReachablePositions(map, start, movementPoints);
            return ReachableDTO.builder()
                    .mapId(mapId)
                    .start(start)
                    .movementPoints(movementPoints)
                    .count(reachable.size())
                    .positions(new ArrayList<>(reachable))
                    .build();
        }
    }

    /**
     * Whether the requested hero can reach the target this turn, along with the path it would take.
     * Same rule as {@link Pathfinder#canReachPosition}, answered from a single search.
     */
    public HeroMoveResult checkMove(String mapId, HeroMoveRequest request) {
        Hero hero = request.toHero();
        GameMap map = mapService.getMap(mapId);
        synchronized (map) {
            List<Position> path = pathfinder.findPath(map, hero.getPosition(), request.getTarget());
            int cost = pathfinder.calculatePathCost(map, path);
            boolean reachable = hero.canMove() && path != null && cost <= hero.getMovementPoints();
            return HeroMoveResult.builder()
                    .reachable(reachable)
                    .movementPoints(hero.getMovementPoints())
                    .path(PathDTO.of(mapId, hero.getPosition(), request.getTarget(), path, cost))
                    .build();
        }
    }

    public MapDetailsDTO getMapDetails(String mapId) {
        GameMap map = mapService.getMap(mapId);
        synchronized (map) {
            return MapDetailsDTO.fromMap(mapId, map);
        }
    }

    /**
     * Reachability of the map from the hero spawns of its definition.
     *
     * @throws IllegalStateException if the map defines no hero spawns
     */
    public ReachabilityStats getReachabilityStats(String mapId) {
        MapDefinition def = mapService.getDefinition(mapId);
        if (def.heroSpawns().isEmpty()) {
            throw new IllegalStateException("Map '" + mapId + "' defines no hero spawns");
        }
        GameMap map = mapService.getMap(mapId);
        synchronized (map) {
            return reachabilityValidator.calculateStats(map, def.heroSpawns());
        }
    }
}
