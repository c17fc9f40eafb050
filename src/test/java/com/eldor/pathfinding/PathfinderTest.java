package com.eldor.pathfinding;

import com.eldor.model.GameMap;
import com.eldor.model.Hero;
import com.eldor.model.Position;
import com.eldor.model.TerrainType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PathfinderTest {

    @Mock
    private PathProvider provider;

    private AStarPathfinder engine;
    private GameMap map;

    @BeforeEach
    void setUp() {
        engine = new AStarPathfinder();
        map = new GameMap(10, 10);
    }

    @Nested
    @DisplayName("without a provider")
    class BuiltInTests {

        private Pathfinder pathfinder;

        @BeforeEach
        void setUp() {
            pathfinder = new Pathfinder(engine);
        }

        @Test
        @DisplayName("should answer with the built-in engine")
        void shouldUseEngine() {
            Position from = new Position(0, 0);
            Position to = new Position(3, 0);

            List<Position> path = pathfinder.findPath(map, from, to);

            assertTrue(pathfinder.getProvider().isEmpty());
            assertEquals(engine.findPath(map, from, to), path);
            assertEquals(300, pathfinder.calculatePathCost(map, path));
            assertEquals(8, pathfinder.getReachablePositions(map, new Position(5, 5), 100).size());
        }

        @Test
        @DisplayName("should reject bad arguments before searching")
        void shouldGuardArguments() {
            assertNull(pathfinder.findPath(null, new Position(0, 0), new Position(1, 1)));
            assertNull(pathfinder.findPath(map, new Position(0, 0), new Position(10, 10)));
            assertEquals(List.of(new Position(2, 2)),
                    pathfinder.findPath(map, new Position(2, 2), new Position(2, 2)));
            assertTrue(pathfinder.getReachablePositions(map, new Position(2, 2), 0).isEmpty());
            assertEquals(0, pathfinder.calculatePathCost(map, List.of(new Position(2, 2))));
        }
    }

    @Nested
    @DisplayName("with a provider")
    class ProviderTests {

        private Pathfinder pathfinder;

        @BeforeEach
        void setUp() {
            pathfinder = new Pathfinder(engine, provider);
        }

        @Test
        @DisplayName("should return the provider's path verbatim")
        void shouldPreferProviderPath() {
            List<Position> custom = List.of(new Position(0, 0), new Position(0, 1), new Position(1, 1));
            when(provider.findPath(map, new Position(0, 0), new Position(1, 1))).thenReturn(custom);

            assertSame(custom, pathfinder.findPath(map, new Position(0, 0), new Position(1, 1)));
            assertTrue(pathfinder.getProvider().isPresent());
        }

        @Test
        @DisplayName("should fall back when the provider has no path")
        void shouldFallBackOnNullOrEmptyPath() {
            when(provider.findPath(any(), any(), any())).thenReturn(null, List.of());

            assertEquals(4, pathfinder.findPath(map, new Position(0, 0), new Position(3, 3)).size());
            assertEquals(4, pathfinder.findPath(map, new Position(0, 0), new Position(3, 3)).size());
            verify(provider, times(2)).findPath(any(), any(), any());
        }

        @Test
        @DisplayName("should not consult the provider for guarded queries")
        void shouldNotConsultProviderForGuardedQueries() {
            pathfinder.findPath(map, new Position(1, 1), new Position(1, 1));
            pathfinder.findPath(map, new Position(-1, 1), new Position(1, 1));
            pathfinder.getReachablePositions(map, new Position(1, 1), 0);
            pathfinder.calculatePathCost(map, List.of(new Position(1, 1)));

            verifyNoInteractions(provider);
        }

        @Test
        @DisplayName("should copy the provider's reachable set")
        void shouldUseProviderReachable() {
            when(provider.getReachablePositions(map, new Position(5, 5), 300))
                    .thenReturn(List.of(new Position(6, 6), new Position(7, 7)));

            Set<Position> reachable = pathfinder.getReachablePositions(map, new Position(5, 5), 300);

            assertEquals(List.of(new Position(6, 6), new Position(7, 7)), List.copyOf(reachable));
        }

        @Test
        @DisplayName("should accept an empty reachable set but fall back on null")
        void shouldDistinguishEmptyFromNullReachable() {
            when(provider.getReachablePositions(any(), any(), anyInt())).thenReturn(List.of(), null);

            assertTrue(pathfinder.getReachablePositions(map, new Position(5, 5), 100).isEmpty());
            assertEquals(8, pathfinder.getReachablePositions(map, new Position(5, 5), 100).size());
        }

        @Test
        @DisplayName("should fall back when the provider reports a negative cost")
        void shouldFallBackOnNegativeCost() {
            List<Position> path = List.of(new Position(0, 0), new Position(1, 0));
            when(provider.calculatePathCost(map, path)).thenReturn(-1, 0, 42);

            assertEquals(100, pathfinder.calculatePathCost(map, path));
            assertEquals(0, pathfinder.calculatePathCost(map, path));
            assertEquals(42, pathfinder.calculatePathCost(map, path));
        }

        @Test
        @DisplayName("should propagate provider failures")
        void shouldPropagateProviderFailures() {
            when(provider.findPath(any(), any(), any())).thenThrow(new IllegalStateException("backend down"));

            assertThrows(IllegalStateException.class,
                    () -> pathfinder.findPath(map, new Position(0, 0), new Position(2, 2)));
        }
    }

    @Nested
    @DisplayName("canReachPosition()")
    class CanReachTests {

        private Pathfinder pathfinder;

        @BeforeEach
        void setUp() {
            pathfinder = new Pathfinder(engine);
        }

        private Hero hero(Position position, int movementPoints) {
            return Hero.builder().name("Tester").position(position).movementPoints(movementPoints).build();
        }

        @Test
        @DisplayName("should compare path cost against movement points")
        void shouldCompareCostWithPoints() {
            map.setTerrain(new Position(2, 0), TerrainType.SWAMP);

            assertTrue(pathfinder.canReachPosition(map, hero(new Position(0, 0), 275), new Position(2, 0)));
            assertFalse(pathfinder.canReachPosition(map, hero(new Position(0, 0), 274), new Position(2, 0)));
            assertTrue(pathfinder.canReachPosition(map, hero(new Position(0, 0), 300), new Position(3, 0)));
            assertFalse(pathfinder.canReachPosition(map, hero(new Position(0, 0), 299), new Position(3, 0)));
        }

        @Test
        @DisplayName("should be false for an exhausted hero or an unreachable target")
        void shouldRejectHopelessMoves() {
            map.setTerrain(new Position(4, 4), TerrainType.ROCK);

            assertFalse(pathfinder.canReachPosition(map, hero(new Position(0, 0), 0), new Position(1, 0)));
            assertFalse(pathfinder.canReachPosition(map, hero(new Position(3, 3), 1000), new Position(4, 4)));
            assertFalse(pathfinder.canReachPosition(map, hero(new Position(3, 3), 1000), new Position(11, 4)));
            assertFalse(pathfinder.canReachPosition(map, null, new Position(1, 0)));
        }
    }

    @Test
    @DisplayName("static helpers should not depend on any map")
    void shouldExposeGridHelpers() {
        Position a = new Position(0, 0);
        Position b = new Position(3, -4);

        assertEquals(7, Pathfinder.manhattanDistance(a, b));
        assertEquals(4, Pathfinder.chebyshevDistance(a, b));
        assertTrue(Pathfinder.isAdjacent(a, new Position(-1, 1)));
        assertFalse(Pathfinder.isAdjacent(a, a));
        assertEquals(8, Pathfinder.getAdjacentPositions(a).size());
        assertTrue(Pathfinder.getAdjacentPositions(a).contains(new Position(-1, -1)));
    }
}
