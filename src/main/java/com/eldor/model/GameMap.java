package com.eldor.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The adventure map: a fixed-size grid of tiles plus the objects placed on it.
 * <p>
 * The map is the only writer of object-to-tile links. It is not thread-safe; callers confine
 * mutation and searches over one map to a single thread or guard them with one lock.
 */
public class GameMap {

    @Getter
    private final int width;

    @Getter
    private final int height;

    @Getter
    @Setter
    private String name;

    @Getter
    @Setter
    private String description = "";

    private final MapTile[][] tiles;

    private final Map<Integer, MapObject> objects = new LinkedHashMap<>();

    private int nextObjectId = 0;

    public GameMap(int width, int height) {
        this(width, height, "Untitled Map");
    }

    /**
     * Creates a map filled with grass.
     *
     * @throws IllegalArgumentException if either dimension is not positive
     */
    public GameMap(int width, int height, String name) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException(
                    "Map dimensions must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.name = name;
        this.tiles = new MapTile[width][height];

        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                tiles[x][y] = new MapTile(TerrainType.GRASS);
            }
        }
    }

    // ── bounds & tiles ──────────────────────────────────────────────────

    public boolean isInBounds(Position pos) {
        return pos != null && isInBounds(pos.x(), pos.y());
    }

    public boolean isInBounds(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    /**
     * @throws IndexOutOfBoundsException if {@code pos} lies outside the map
     */
    public MapTile getTile(Position pos) {
        requireInBounds(pos);
        return tiles[pos.x()][pos.y()];
    }

    public MapTile getTile(int x, int y) {
        return getTile(new Position(x, y));
    }

    /**
     * Changes a tile's terrain. Coastal flags are left as they are until the next
     * {@link #calculateCoastalTiles()} pass, so a batch of edits costs one recomputation.
     *
     * @throws IndexOutOfBoundsException if {@code pos} lies outside the map
     */
    public void setTerrain(Position pos, TerrainType terrain) {
        getTile(pos).setTerrain(terrain);
    }

    public boolean isPassable(Position pos) {
        return isInBounds(pos) && getTile(pos).isPassable();
    }

    public boolean isClear(Position pos) {
        return isInBounds(pos) && getTile(pos).isClear();
    }

    // ── objects ─────────────────────────────────────────────────────────

    /**
     * Places an object, assigns it the next instance id and links it to the tiles it blocks and
     * can be visited from. Linked cells outside the map are skipped.
     *
     * @return the assigned instance id
     * @throws IndexOutOfBoundsException if the object's anchor lies outside the map
     */
    public int addObject(MapObject obj) {
        if (obj == null) {
            throw new NullPointerException("Map object must not be null");
        }
        requireInBounds(obj.getPosition());

        int id = nextObjectId++;
        obj.setInstanceId(id);
        objects.put(id, obj);
        link(obj);
        return id;
    }

    /**
     * Detaches an object from every tile it was linked to and drops it. The id is not reused.
     *
     * @return false if no object has this id
     */
    public boolean removeObject(int objectId) {
        MapObject obj = objects.remove(objectId);
        if (obj == null) {
            return false;
        }
        unlink(obj);
        return true;
    }

    /**
     * Moves an object to a new anchor cell, relinking it to the tiles around its new position.
     * The object keeps its instance id.
     *
     * @return false if no object has this id
     * @throws IndexOutOfBoundsException if {@code target} lies outside the map
     */
    public boolean moveObject(int objectId, Position target) {
        MapObject obj = objects.get(objectId);
        if (obj == null) {
            return false;
        }
        requireInBounds(target);

        unlink(obj);
        obj.setPosition(target);
        link(obj);
        return true;
    }

    /**
     * @return the object, or null if no object has this id
     */
    public MapObject getObject(int objectId) {
        return objects.get(objectId);
    }

    /**
     * Objects linked to a tile: visitable ones first in visiting order, then blocking ones.
     */
    public List<MapObject> getObjectsAt(Position pos) {
        if (!isInBounds(pos)) {
            return new ArrayList<>();
        }
        MapTile tile = getTile(pos);
        Set<Integer> ids = new LinkedHashSet<>(tile.getVisitableObjectIds());
        ids.addAll(tile.getBlockingObjectIds());

        List<MapObject> result = new ArrayList<>();
        for (Integer id : ids) {
            MapObject obj = objects.get(id);
            if (obj != null) {
                result.add(obj);
            }
        }
        return result;
    }

    public List<MapObject> getObjectsByType(MapObjectType type) {
        return objects.values().stream()
                .filter(obj -> obj.getObjectType() == type)
                .toList();
    }

    public <T extends MapObject> List<T> getObjectsOfClass(Class<T> type) {
        return objects.values().stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }

    public Collection<MapObject> getAllObjects() {
        return Collections.unmodifiableCollection(objects.values());
    }

    public int getObjectCount() {
        return objects.size();
    }

    /**
     * Adds one week of creatures to every dwelling on the map.
     */
    public void applyWeeklyGrowth() {
        getObjectsOfClass(DwellingObject.class).forEach(DwellingObject::applyWeeklyGrowth);
    }

    // ── movement ────────────────────────────────────────────────────────

    /**
     * A single step is legal between 8-adjacent in-bounds tiles when the destination is passable
     * and not blocked. Diagonal steps between two blocked orthogonal cells are allowed.
     */
    public boolean canMoveBetween(Position from, Position to) {
        if (!isInBounds(from) || !isInBounds(to)) {
            return false;
        }
        if (!from.isAdjacentTo(to)) {
            return false;
        }
        return getTile(to).isClear();
    }

    /**
     * Cost of a single step, or {@link Integer#MAX_VALUE} when the step is not legal.
     */
    public int getMovementCost(Position from, Position to) {
        if (!canMoveBetween(from, to)) {
            return Integer.MAX_VALUE;
        }
        return getTile(to).getMovementCost();
    }

    /**
     * The in-bounds part of a tile's 8-neighborhood.
     */
    public List<Position> getAdjacentPositions(Position pos) {
        List<Position> adjacent = new ArrayList<>(8);
        for (Position neighbor : pos.neighbors()) {
            if (isInBounds(neighbor)) {
                adjacent.add(neighbor);
            }
        }
        return adjacent;
    }

    /**
     * Full-grid pass: a non-water tile is coastal when any neighbor is water; water is never coastal.
     * Not triggered by {@link #setTerrain(Position, TerrainType)}.
     */
    public void calculateCoastalTiles() {
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) {
                MapTile tile = tiles[x][y];
                if (tile.isWater()) {
                    tile.setCoastal(false);
                    continue;
                }
                boolean coastal = false;
                for (Position neighbor : getAdjacentPositions(new Position(x, y))) {
                    if (tiles[neighbor.x()][neighbor.y()].isWater()) {
                        coastal = true;
                        break;
                    }
                }
                tile.setCoastal(coastal);
            }
        }
    }

    private void link(MapObject obj) {
        for (Position pos : obj.getBlockedPositions()) {
            if (isInBounds(pos)) {
                tiles[pos.x()][pos.y()].addBlockingObject(obj.getInstanceId());
            }
        }
        for (Position pos : obj.getVisitablePositions()) {
            if (isInBounds(pos)) {
                tiles[pos.x()][pos.y()].addVisitableObject(obj.getInstanceId());
            }
        }
    }

    private void unlink(MapObject obj) {
        for (Position pos : obj.getBlockedPositions()) {
            if (isInBounds(pos)) {
                tiles[pos.x()][pos.y()].removeBlockingObject(obj.getInstanceId());
            }
        }
        for (Position pos : obj.getVisitablePositions()) {
            if (isInBounds(pos)) {
                tiles[pos.x()][pos.y()].removeVisitableObject(obj.getInstanceId());
            }
        }
    }

    private void requireInBounds(Position pos) {
        if (!isInBounds(pos)) {
            throw new IndexOutOfBoundsException(
                    "Position " + pos + " is outside map bounds " + width + "x" + height);
        }
    }

    @Override
    public String toString() {
        return "Map '" + name + "' (" + width + "x" + height + ", " + objects.size() + " objects)";
    }
}
