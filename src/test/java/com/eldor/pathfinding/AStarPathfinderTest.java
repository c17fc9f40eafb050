package com.eldor.pathfinding;

import com.eldor.model.GameMap;
import com.eldor.model.MapObject;
import com.eldor.model.MineObject;
import com.eldor.model.Position;
import com.eldor.model.ResourceType;
import com.eldor.model.TerrainType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AStarPathfinderTest {

    private AStarPathfinder pathfinder;
    private GameMap map;

    @BeforeEach
    void setUp() {
        pathfinder = new AStarPathfinder();
        map = new GameMap(20, 20);
    }

    private void assertWalkable(List<Position> path) {
        for (int i = 0; i < path.size() - 1; i++) {
            assertTrue(map.canMoveBetween(path.get(i), path.get(i + 1)),
                    "illegal step " + path.get(i) + " -> " + path.get(i + 1));
        }
    }

    @Nested
    @DisplayName("findPath()")
    class FindPathTests {

        @Test
        @DisplayName("should return the single tile when start equals end")
        void shouldReturnStartForSameTile() {
            Position pos = new Position(4, 4);

            List<Position> path = pathfinder.findPath(map, pos, pos);

            assertEquals(List.of(pos), path);
            assertEquals(0, pathfinder.calculatePathCost(map, path));
        }

        @Test
        @DisplayName("should walk a straight line on open grass")
        void shouldWalkStraightLine() {
            List<Position> path = pathfinder.findPath(map, new Position(0, 0), new Position(5, 0));

            assertNotNull(path);
            assertEquals(6, path.size());
            assertEquals(new Position(0, 0), path.get(0));
            assertEquals(new Position(5, 0), path.get(5));
            assertEquals(500, pathfinder.calculatePathCost(map, path));
        }

        @Test
        @DisplayName("should move diagonally at the cost of a single step")
        void shouldUseDiagonals() {
            List<Position> path = pathfinder.findPath(map, new Position(0, 0), new Position(5, 5));

            assertNotNull(path);
            assertEquals(6, path.size());
            assertEquals(500, pathfinder.calculatePathCost(map, path));
            assertWalkable(path);
        }

        @Test
        @DisplayName("should step around a swamp tile when the detour is free")
        void shouldAvoidSwamp() {
            Position swamp = new Position(5, 4);
            map.setTerrain(swamp, TerrainType.SWAMP);

            List<Position> path = pathfinder.findPath(map, new Position(2, 4), new Position(8, 4));

            assertNotNull(path);
            assertFalse(path.contains(swamp));
            assertEquals(600, pathfinder.calculatePathCost(map, path));
        }

        @Test
        @DisplayName("should cross a swamp band when going around costs more")
        void shouldCrossSwampWhenCheaper() {
            for (int y = 0; y <= 8; y++) {
                map.setTerrain(new Position(5, y), TerrainType.SWAMP);
            }

            List<Position> path = pathfinder.findPath(map, new Position(2, 4), new Position(8, 4));

            assertNotNull(path);
            assertEquals(675, pathfinder.calculatePathCost(map, path));
        }

        @Test
        @DisplayName("should route through the only gap in a rock wall")
        void shouldRouteThroughGap() {
            for (int y = 0; y < 19; y++) {
                map.setTerrain(new Position(10, y), TerrainType.ROCK);
            }

            List<Position> path = pathfinder.findPath(map, new Position(5, 5), new Position(15, 5));

            assertNotNull(path);
            assertTrue(path.contains(new Position(10, 19)));
            assertWalkable(path);
            path.forEach(pos -> assertTrue(map.getTile(pos).isPassable()));
        }

        @Test
        @DisplayName("should go around blocking objects")
        void shouldAvoidBlockingObjects() {
            for (int x = 3; x <= 7; x++) {
                map.addObject(MapObject.obstacle(new Position(x, 5)));
            }

            List<Position> path = pathfinder.findPath(map, new Position(5, 3), new Position(5, 7));

            assertNotNull(path);
            path.forEach(pos -> assertTrue(map.getTile(pos).isClear(), pos + " is blocked"));
            assertWalkable(path);
        }

        @Test
        @DisplayName("should return null for an enclosed goal")
        void shouldReturnNullWhenEnclosed() {
            Position goal = new Position(10, 10);
            for (Position wall : goal.neighbors()) {
                map.setTerrain(wall, TerrainType.ROCK);
            }

            assertNull(pathfinder.findPath(map, new Position(0, 0), goal));
        }

        @Test
        @DisplayName("should return null when the goal cannot be entered")
        void shouldReturnNullForBlockedGoal() {
            map.setTerrain(new Position(3, 3), TerrainType.ROCK);
            map.addObject(new MineObject(new Position(6, 6), ResourceType.ORE));

            assertNull(pathfinder.findPath(map, new Position(0, 0), new Position(3, 3)));
            assertNull(pathfinder.findPath(map, new Position(0, 0), new Position(6, 6)));
        }

        @Test
        @DisplayName("should return null for bad arguments")
        void shouldReturnNullForBadArguments() {
            assertNull(pathfinder.findPath(null, new Position(0, 0), new Position(1, 1)));
            assertNull(pathfinder.findPath(map, new Position(-1, 0), new Position(1, 1)));
            assertNull(pathfinder.findPath(map, new Position(0, 0), new Position(20, 1)));
        }
    }

    @Nested
    @DisplayName("calculatePathCost()")
    class PathCostTests {

        @Test
        @DisplayName("should sum destination costs of every step")
        void shouldSumStepCosts() {
            map.setTerrain(new Position(1, 0), TerrainType.SAND);
            map.setTerrain(new Position(2, 0), TerrainType.SWAMP);
            List<Position> path = List.of(new Position(0, 0), new Position(1, 0),
                    new Position(2, 0), new Position(3, 0));

            assertEquals(150 + 175 + 100, pathfinder.calculatePathCost(map, path));
        }

        @Test
        @DisplayName("should be zero for trivial paths")
        void shouldBeZeroForTrivialPaths() {
            assertEquals(0, pathfinder.calculatePathCost(map, null));
            assertEquals(0, pathfinder.calculatePathCost(map, List.of()));
            assertEquals(0, pathfinder.calculatePathCost(map, List.of(new Position(1, 1))));
        }

        @Test
        @DisplayName("should saturate at the sentinel for an illegal step")
        void shouldSaturateOnIllegalStep() {
            List<Position> path = List.of(new Position(0, 0), new Position(1, 0), new Position(5, 5));

            assertEquals(Integer.MAX_VALUE, pathfinder.calculatePathCost(map, path));
        }
    }

    @Nested
    @DisplayName("getReachablePositions()")
    class ReachableTests {

        @Test
        @DisplayName("one step of points should reach the eight neighbors")
        void shouldReachNeighbors() {
            Position start = new Position(10, 10);

            Set<Position> reachable = pathfinder.getReachablePositions(map, start, 100);

            assertEquals(Set.copyOf(start.neighbors()), reachable);
        }

        @Test
        @DisplayName("two steps of points should reach a 5x5 square minus the start")
        void shouldReachTwoRings() {
            Set<Position> reachable = pathfinder.getReachablePositions(map, new Position(10, 10), 200);

            assertEquals(24, reachable.size());
            assertFalse(reachable.contains(new Position(10, 10)));
        }

        @Test
        @DisplayName("should be empty for a non-positive budget or bad start")
        void shouldBeEmptyForBadArguments() {
            assertTrue(pathfinder.getReachablePositions(map, new Position(1, 1), 0).isEmpty());
            assertTrue(pathfinder.getReachablePositions(map, new Position(1, 1), -50).isEmpty());
            assertTrue(pathfinder.getReachablePositions(map, new Position(30, 1), 500).isEmpty());
            assertTrue(pathfinder.getReachablePositions(null, new Position(1, 1), 500).isEmpty());
        }

        @Test
        @DisplayName("should exclude rock and blocked tiles")
        void shouldExcludeImpassable() {
            map.setTerrain(new Position(11, 10), TerrainType.ROCK);
            map.addObject(MapObject.obstacle(new Position(9, 10)));

            Set<Position> reachable = pathfinder.getReachablePositions(map, new Position(10, 10), 300);

            assertFalse(reachable.contains(new Position(11, 10)));
            assertFalse(reachable.contains(new Position(9, 10)));
            assertTrue(reachable.contains(new Position(12, 10)));
        }

        @Test
        @DisplayName("should agree with findPath() costs on mixed terrain")
        void shouldAgreeWithFindPath() {
            map.setTerrain(new Position(6, 5), TerrainType.SWAMP);
            map.setTerrain(new Position(6, 6), TerrainType.SWAMP);
            map.setTerrain(new Position(4, 6), TerrainType.SAND);
            map.setTerrain(new Position(5, 7), TerrainType.ROCK);
            map.setTerrain(new Position(7, 4), TerrainType.ROUGH);
            map.addObject(MapObject.obstacle(new Position(4, 4)));

            Position start = new Position(5, 5);
            int budget = 275;
            Set<Position> reachable = pathfinder.getReachablePositions(map, start, budget);

            for (int x = 0; x < 12; x++) {
                for (int y = 0; y < 12; y++) {
                    Position pos = new Position(x, y);
                    if (pos.equals(start)) {
                        continue;
                    }
                    List<Position> path = pathfinder.findPath(map, start, pos);
                    boolean affordable = path != null && pathfinder.calculatePathCost(map, path) <= budget;
                    assertEquals(affordable, reachable.contains(pos), "mismatch at " + pos);
                }
            }
        }

        @Test
        @DisplayName("should list tiles in order of increasing cost")
        void shouldOrderByCost() {
            map.setTerrain(new Position(11, 10), TerrainType.SNOW);
            map.setTerrain(new Position(9, 9), TerrainType.SWAMP);
            Position start = new Position(10, 10);

            List<Integer> costs = new ArrayList<>();
            for (Position pos : pathfinder.getReachablePositions(map, start, 400)) {
                costs.add(pathfinder.calculatePathCost(map, pathfinder.findPath(map, start, pos)));
            }

            for (int i = 1; i < costs.size(); i++) {
                assertTrue(costs.get(i - 1) <= costs.get(i), "costs out of order: " + costs);
            }
        }
    }
}
