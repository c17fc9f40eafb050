package com.eldor.pathfinding;

import com.eldor.model.GameMap;
import com.eldor.model.Position;

import java.util.Collection;
import java.util.List;

/**
 * An external pathfinding backend that {@link Pathfinder} consults before its built-in engine.
 * <p>
 * Each operation may decline by returning its "unavailable" value, in which case the built-in
 * engine answers instead. A provider only needs to implement the operations it supports.
 */
public interface PathProvider {

    /**
     * @return the path from {@code start} to {@code end} inclusive, or null (or an empty list) if unavailable
     */
    default List<Position> findPath(GameMap map, Position start, Position end) {
        return null;
    }

    /**
     * @return the tiles reachable within {@code movementPoints}, or null if unavailable
     */
    default Collection<Position> getReachablePositions(GameMap map, Position start, int movementPoints) {
        return null;
    }

    /**
     * @return the movement cost of {@code path}, or a negative value if unavailable
     */
    default int calculatePathCost(GameMap map, List<Position> path) {
        return -1;
    }
}
