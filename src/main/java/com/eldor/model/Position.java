package com.eldor.model;

import java.util.List;

/**
 * Immutable tile coordinate on the adventure map.
 *
 * @param x column, growing east
 * @param y row, growing south
 */
public record Position(int x, int y) {

    public int manhattanDistance(Position other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    public int chebyshevDistance(Position other) {
        return Math.max(Math.abs(x - other.x), Math.abs(y - other.y));
    }

    public double distance(Position other) {
        int dx = x - other.x;
        int dy = y - other.y;
        return Math.sqrt(dx * dx + dy * dy);
    }

    /**
     * True for the eight surrounding tiles, false for this tile itself.
     */
    public boolean isAdjacentTo(Position other) {
        return chebyshevDistance(other) == 1;
    }

    public Position offset(int dx, int dy) {
        return new Position(x + dx, y + dy);
    }

    /**
     * The 8-neighborhood in NW, N, NE, W, E, SW, S, SE order, without any bounds check.
     */
    public List<Position> neighbors() {
        return List.of(
                offset(-1, -1), offset(0, -1), offset(1, -1),
                offset(-1, 0), offset(1, 0),
                offset(-1, 1), offset(0, 1), offset(1, 1));
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
