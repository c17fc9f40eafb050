package com.eldor.model;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * State of a single map cell: its terrain and the objects attached to it.
 * <p>
 * Tiles are created and mutated by {@link GameMap} only; everything public here is read-only.
 */
@Getter
public class MapTile {

    private TerrainType terrain;

    /** Derived cache, refreshed by {@link GameMap#calculateCoastalTiles()}. */
    private boolean coastal;

    @Getter(AccessLevel.NONE)
    private final List<Integer> visitableObjectIds = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final Set<Integer> blockingObjectIds = new LinkedHashSet<>();

    MapTile(TerrainType terrain) {
        this.terrain = terrain;
    }

    public int getMovementCost() {
        return terrain.getMovementCost();
    }

    public boolean isPassable() {
        return terrain.isPassable();
    }

    public boolean isWater() {
        return terrain.isWater();
    }

    public boolean isLand() {
        return isPassable() && !isWater();
    }

    public boolean isBlocked() {
        return !blockingObjectIds.isEmpty();
    }

    public boolean isClear() {
        return isPassable() && !isBlocked();
    }

    public boolean isVisitable() {
        return !visitableObjectIds.isEmpty();
    }

    /**
     * Visitable object ids in visiting order; the last one is on top.
     */
    public List<Integer> getVisitableObjectIds() {
        return Collections.unmodifiableList(visitableObjectIds);
    }

    public Set<Integer> getBlockingObjectIds() {
        return Collections.unmodifiableSet(blockingObjectIds);
    }

    /**
     * Id of the object a hero interacts with first on this tile, or -1 if there is none.
     */
    public int getTopVisitableObjectId() {
        return visitableObjectIds.isEmpty() ? -1 : visitableObjectIds.get(visitableObjectIds.size() - 1);
    }

    public boolean hasVisitableObject(int objectId) {
        return visitableObjectIds.contains(objectId);
    }

    public boolean hasBlockingObject(int objectId) {
        return blockingObjectIds.contains(objectId);
    }

    void setTerrain(TerrainType terrain) {
        this.terrain = terrain;
    }

    void setCoastal(boolean coastal) {
        this.coastal = coastal;
    }

    void addVisitableObject(int objectId) {
        if (!visitableObjectIds.contains(objectId)) {
            visitableObjectIds.add(objectId);
        }
    }

    void addBlockingObject(int objectId) {
        blockingObjectIds.add(objectId);
    }

    void removeVisitableObject(int objectId) {
        visitableObjectIds.remove(Integer.valueOf(objectId));
    }

    void removeBlockingObject(int objectId) {
        blockingObjectIds.remove(objectId);
    }

    @Override
    public String toString() {
        return "Tile(" + terrain + ", cost: " + getMovementCost()
                + ", blocked: " + isBlocked() + ", visitable: " + isVisitable() + ")";
    }
}
