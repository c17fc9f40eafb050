package com.eldor.pathfinding;

import com.eldor.model.GameMap;
import com.eldor.model.Hero;
import com.eldor.model.Position;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for hero movement queries.
 * <p>
 * Arguments are validated here first; a query that passes is offered to the injected
 * {@link PathProvider}, if any, and its answer is returned verbatim when usable. Otherwise the
 * built-in {@link AStarPathfinder} answers. Call sites never need to know which one did.
 */
@Slf4j
public class Pathfinder {

    private final AStarPathfinder engine;
    private final PathProvider provider;

    public Pathfinder(AStarPathfinder engine) {
        this(engine, null);
    }

    public Pathfinder(AStarPathfinder engine, PathProvider provider) {
        this.engine = engine;
        this.provider = provider;
    }

    public Optional<PathProvider> getProvider() {
        return Optional.ofNullable(provider);
    }

    /**
     * @return the path from {@code start} to {@code end} inclusive, or null when there is none
     */
    public List<Position> findPath(GameMap map, Position start, Position end) {
        if (map == null || !map.isInBounds(start) || !map.isInBounds(end)) {
            return null;
        }
        if (start.equals(end)) {
            return new ArrayList<>(List.of(start));
        }

        if (provider != null) {
            List<Position> path = provider.findPath(map, start, end);
            if (path != null && !path.isEmpty()) {
                return path;
            }
            log.debug("Path provider had no path {} -> {}, using built-in search", start, end);
        }
        return engine.findPath(map, start, end);
    }

    /**
     * @return reachable tiles excluding {@code start}; empty for a bad start or a non-positive budget
     */
    public Set<Position> getReachablePositions(GameMap map, Position start, int movementPoints) {
        if (map == null || !map.isInBounds(start) || movementPoints <= 0) {
            return new LinkedHashSet<>();
        }

        if (provider != null) {
            Collection<Position> reachable = provider.getReachablePositions(map, start, movementPoints);
            if (reachable != null) {
                return new LinkedHashSet<>(reachable);
            }
            log.debug("Path provider had no reachable set from {}, using built-in search", start);
        }
        return engine.getReachablePositions(map, start, movementPoints);
    }

    public int calculatePathCost(GameMap map, List<Position> path) {
        if (map == null || path == null || path.size() < 2) {
            return 0;
        }

        if (provider != null) {
            int cost = provider.calculatePathCost(map, path);
            if (cost >= 0) {
                return cost;
            }
        }
        return engine.calculatePathCost(map, path);
    }

    /**
     * A hero can reach {@code target} this turn when a path exists and costs no more than its
     * remaining movement points.
     */
    public boolean canReachPosition(GameMap map, Hero hero, Position target) {
        if (map == null || hero == null || !map.isInBounds(target) || !hero.canMove()) {
            return false;
        }

        List<Position> path = findPath(map, hero.getPosition(), target);
        if (path == null) {
            return false;
        }
        return calculatePathCost(map, path) <= hero.getMovementPoints();
    }

    // ── map-independent helpers ─────────────────────────────────────────

    public static boolean isAdjacent(Position a, Position b) {
        return a.isAdjacentTo(b);
    }

    /**
     * All eight neighbors of {@code center}, whether or not they lie on any map.
     */
    public static List<Position> getAdjacentPositions(Position center) {
        return center.neighbors();
    }

    public static int manhattanDistance(Position a, Position b) {
        return a.manhattanDistance(b);
    }

    public static int chebyshevDistance(Position a, Position b) {
        return a.chebyshevDistance(b);
    }
}
