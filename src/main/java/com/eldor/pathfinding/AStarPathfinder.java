package com.eldor.pathfinding;

import com.eldor.model.GameMap;
import com.eldor.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Built-in hero pathfinder: A* over the 8-connected tile grid with per-terrain step costs.
 * <p>
 * Holds no state between calls; every query builds its own open set, closed set and node table,
 * so one instance can be shared freely as long as the map itself is not mutated mid-search.
 */
@Component
@Slf4j
public class AStarPathfinder {

    /**
     * Cheapest path from {@code start} to {@code end}, both included.
     *
     * @return the path, or null when either end is off the map, the goal cannot be entered,
     *         or the goal is unreachable
     */
    public List<Position> findPath(GameMap map, Position start, Position end) {
        if (map == null || !map.isInBounds(start) || !map.isInBounds(end)) {
            return null;
        }
        if (start.equals(end)) {
            return new ArrayList<>(List.of(start));
        }
        if (!map.getTile(end).isPassable()) {
            return null;
        }

        NodePriorityQueue<PathNode> openSet = new NodePriorityQueue<>();
        Set<Position> closedSet = new HashSet<>();
        Map<Position, PathNode> allNodes = new HashMap<>();

        PathNode startNode = new PathNode(start, null, 0, start.manhattanDistance(end));
        openSet.enqueue(startNode);
        allNodes.put(start, startNode);

        while (!openSet.isEmpty()) {
            PathNode current = openSet.dequeue();

            if (current.getPosition().equals(end)) {
                List<Position> path = reconstructPath(current);
                log.debug("Path {} -> {} found: {} steps, cost {}, {} nodes closed",
                        start, end, path.size() - 1, current.getGCost(), closedSet.size());
                return path;
            }

            closedSet.add(current.getPosition());

            for (Position neighborPos : current.getPosition().neighbors()) {
                if (closedSet.contains(neighborPos) || !isEnterable(map, current.getPosition(), neighborPos)) {
                    continue;
                }

                int tentativeGCost = current.getGCost() + map.getMovementCost(current.getPosition(), neighborPos);
                PathNode neighborNode = allNodes.get(neighborPos);

                if (neighborNode == null) {
                    neighborNode = new PathNode(neighborPos, current, tentativeGCost,
                            neighborPos.manhattanDistance(end));
                    allNodes.put(neighborPos, neighborNode);
                    openSet.enqueue(neighborNode);
                } else if (tentativeGCost < neighborNode.getGCost()) {
                    neighborNode.setGCost(tentativeGCost);
                    neighborNode.setParent(current);
                    openSet.updatePriority(neighborNode);
                }
            }
        }

        log.debug("No path {} -> {} ({} nodes closed)", start, end, closedSet.size());
        return null;
    }

    /**
     * Sum of the step costs along a path; 0 for null, empty and single-tile paths.
     * An illegal step contributes {@link Integer#MAX_VALUE}, and the total saturates there.
     */
    public int calculatePathCost(GameMap map, List<Position> path) {
        if (map == null || path == null || path.size() < 2) {
            return 0;
        }
        long totalCost = 0;
        for (int i = 0; i < path.size() - 1; i++) {
            totalCost += map.getMovementCost(path.get(i), path.get(i + 1));
        }
        return (int) Math.min(totalCost, Integer.MAX_VALUE);
    }

    /**
     * Every tile a hero standing on {@code start} can reach spending at most
     * {@code movementPoints}, in order of increasing cost. The start tile itself is excluded.
     *
     * @return an empty set when the start is off the map or the budget is not positive
     */
    public Set<Position> getReachablePositions(GameMap map, Position start, int movementPoints) {
        if (map == null || !map.isInBounds(start) || movementPoints <= 0) {
            return new LinkedHashSet<>();
        }

        Set<Position> reachable = new LinkedHashSet<>();
        NodePriorityQueue<PathNode> openSet = new NodePriorityQueue<>();
        Map<Position, Integer> bestCost = new HashMap<>();

        openSet.enqueue(new PathNode(start, null, 0, 0));
        bestCost.put(start, 0);

        while (!openSet.isEmpty()) {
            PathNode current = openSet.dequeue();
            Position currentPos = current.getPosition();

            // superseded by a cheaper entry for the same tile
            if (current.getGCost() > bestCost.get(currentPos)) {
                continue;
            }

            if (!currentPos.equals(start) && current.getGCost() <= movementPoints) {
                reachable.add(currentPos);
            }

            for (Position neighborPos : currentPos.neighbors()) {
                if (!isEnterable(map, currentPos, neighborPos)) {
                    continue;
                }

                int tentativeGCost = current.getGCost() + map.getMovementCost(currentPos, neighborPos);
                if (tentativeGCost > movementPoints) {
                    continue;
                }

                Integer known = bestCost.get(neighborPos);
                if (known == null || tentativeGCost < known) {
                    bestCost.put(neighborPos, tentativeGCost);
                    openSet.enqueue(new PathNode(neighborPos, current, tentativeGCost, 0));
                }
            }
        }

        log.debug("{} tiles reachable from {} with {} movement points", reachable.size(), start, movementPoints);
        return reachable;
    }

    private boolean isEnterable(GameMap map, Position from, Position to) {
        return map.isInBounds(to)
                && map.getTile(to).isPassable()
                && map.canMoveBetween(from, to);
    }

    private List<Position> reconstructPath(PathNode endNode) {
        List<Position> path = new ArrayList<>();
        for (PathNode node = endNode; node != null; node = node.getParent()) {
            path.add(node.getPosition());
        }
        Collections.reverse(path);
        return path;
    }
}
