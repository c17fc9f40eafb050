package com.eldor.service;

import com.eldor.dto.ReachabilityResult;
import com.eldor.dto.ReachabilityStats;
import com.eldor.model.GameMap;
import com.eldor.model.MapObject;
import com.eldor.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Map quality checks: finds objects heroes can never walk to from their spawn points and
 * moves or removes them.
 * <p>
 * Reachability here is a plain flood fill over passable terrain; objects do not block it.
 */
@Service
@Slf4j
public class ReachabilityValidator {

    public static final int DEFAULT_SEARCH_RADIUS = 5;

    /**
     * All passable tiles connected to any of the start tiles, the starts included.
     * Starts that are off the map or impassable are ignored.
     */
    public Set<Position> findReachableTiles(GameMap map, Collection<Position> startPositions) {
        Set<Position> reachable = new LinkedHashSet<>();
        Deque<Position> queue = new ArrayDeque<>();

        for (Position start : startPositions) {
            if (map.isPassable(start) && reachable.add(start)) {
                queue.add(start);
            }
        }

        while (!queue.isEmpty()) {
            Position current = queue.poll();
            for (Position neighbor : map.getAdjacentPositions(current)) {
                if (!reachable.contains(neighbor) && map.isPassable(neighbor)) {
                    reachable.add(neighbor);
                    queue.add(neighbor);
                }
            }
        }
        return reachable;
    }

    public List<MapObject> findUnreachableObjects(GameMap map, Collection<Position> startPositions) {
        return findUnreachableObjects(map, findReachableTiles(map, startPositions));
    }

    /**
     * @return how many objects were removed
     */
    public int removeUnreachableObjects(GameMap map, Collection<Position> startPositions) {
        List<MapObject> unreachable = findUnreachableObjects(map, startPositions);
        unreachable.forEach(obj -> map.removeObject(obj.getInstanceId()));
        if (!unreachable.isEmpty()) {
            log.info("Removed {} unreachable objects from '{}'", unreachable.size(), map.getName());
        }
        return unreachable.size();
    }

    /**
     * Moves every unreachable object to the nearest reachable clear tile within
     * {@code maxSearchRadius} (Manhattan rings), removing it when there is none. A relocated
     * object keeps its instance id.
     */
    public ReachabilityResult fixUnreachableObjects(GameMap map, Collection<Position> startPositions,
                                                    int maxSearchRadius) {
        Set<Position> reachableTiles = findReachableTiles(map, startPositions);
        List<MapObject> unreachable = findUnreachableObjects(map, reachableTiles);

        ReachabilityResult result = ReachabilityResult.builder()
                .totalReachableTiles(reachableTiles.size())
                .totalUnreachableObjects(unreachable.size())
                .build();

        for (MapObject obj : unreachable) {
            Position target = findNearestReachablePosition(map, obj.getPosition(), reachableTiles, maxSearchRadius);

            if (target != null) {
                log.debug("Relocating {} to {}", obj, target);
                map.moveObject(obj.getInstanceId(), target);
                result.setObjectsRelocated(result.getObjectsRelocated() + 1);
            } else {
                log.debug("No reachable spot near {}, removing it", obj);
                map.removeObject(obj.getInstanceId());
                result.setObjectsRemoved(result.getObjectsRemoved() + 1);
            }
        }

        log.info("Reachability fix on '{}': {} relocated, {} removed",
                map.getName(), result.getObjectsRelocated(), result.getObjectsRemoved());
        return result;
    }

    public ReachabilityStats calculateStats(GameMap map, Collection<Position> startPositions) {
        Set<Position> reachableTiles = findReachableTiles(map, startPositions);
        List<MapObject> unreachable = findUnreachableObjects(map, reachableTiles);

        int passable = 0;
        for (int x = 0; x < map.getWidth(); x++) {
            for (int y = 0; y < map.getHeight(); y++) {
                if (map.getTile(x, y).isPassable()) {
                    passable++;
                }
            }
        }

        return ReachabilityStats.builder()
                .totalTiles(map.getWidth() * map.getHeight())
                .passableTiles(passable)
                .reachableTiles(reachableTiles.size())
                .unreachableTiles(passable - reachableTiles.size())
                .totalObjects(map.getObjectCount())
                .unreachableObjects(unreachable.size())
                .reachabilityPercentage(passable > 0 ? (double) reachableTiles.size() / passable : 0.0)
                .build();
    }

    private List<MapObject> findUnreachableObjects(GameMap map, Set<Position> reachableTiles) {
        List<MapObject> unreachable = new ArrayList<>();
        for (MapObject obj : map.getAllObjects()) {
            if (!reachableTiles.contains(obj.getPosition())) {
                unreachable.add(obj);
            } else if (obj.isVisitable()
                    && obj.getVisitablePositions().stream().noneMatch(reachableTiles::contains)) {
                unreachable.add(obj);
            }
        }
        return unreachable;
    }

    private Position findNearestReachablePosition(GameMap map, Position target, Set<Position> reachableTiles,
                                                  int maxRadius) {
        for (int radius = 1; radius <= maxRadius; radius++) {
            for (int dx = -radius; dx <= radius; dx++) {
                for (int dy = -radius; dy <= radius; dy++) {
                    if (Math.abs(dx) + Math.abs(dy) != radius) {
                        continue;
                    }
                    Position candidate = target.offset(dx, dy);
                    if (reachableTiles.contains(candidate) && map.isClear(candidate)) {
                        return candidate;
                    }
                }
            }
        }
        return null;
    }
}
