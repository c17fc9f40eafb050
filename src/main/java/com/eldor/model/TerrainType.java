package com.eldor.model;

/**
 * Terrain of a map tile together with the cost of entering it.
 */
public enum TerrainType {
    DIRT(100),
    SAND(150),
    GRASS(100),
    SNOW(150),
    SWAMP(175),
    ROUGH(125),
    SUBTERRANEAN(100),
    LAVA(100),
    WATER(100),
    ROCK(Integer.MAX_VALUE),
    BORDER(Integer.MAX_VALUE);

    private final int movementCost;

    TerrainType(int movementCost) {
        this.movementCost = movementCost;
    }

    /**
     * Movement points needed to step onto a tile of this terrain,
     * {@link Integer#MAX_VALUE} when it cannot be entered at all.
     */
    public int getMovementCost() {
        return movementCost;
    }

    public boolean isPassable() {
        return movementCost != Integer.MAX_VALUE;
    }

    public boolean isWater() {
        return this == WATER;
    }
}
