package com.eldor.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * An object placed on the adventure map.
 * <p>
 * Plain instances cover decorative and generic objects; {@link ResourceObject}, {@link MineObject}
 * and {@link DwellingObject} add their own payload and default flags. The cells an object blocks
 * and the cells it can be visited from depend only on its position and flags, so variants never
 * override {@link #getBlockedPositions()} or {@link #getVisitablePositions()}.
 */
@Getter
public class MapObject {

    /** Assigned by {@link GameMap#addObject(MapObject)}; -1 while the object is not on a map. */
    @Setter(AccessLevel.PACKAGE)
    private int instanceId = -1;

    private final MapObjectType objectType;

    /** Anchor cell. Objects on a map are moved with {@link GameMap#moveObject(int, Position)}. */
    @Setter(AccessLevel.PACKAGE)
    private Position position;

    private PlayerColor owner = PlayerColor.NEUTRAL;

    @Setter
    private String instanceName = "";

    @Getter(AccessLevel.NONE)
    private final boolean blocksMovement;

    private final boolean visitable;

    /** The object's own cell cannot be stood on; it is visited from a neighboring cell. */
    private final boolean blockedVisitable;

    private final boolean removable;

    public MapObject(MapObjectType objectType, Position position, boolean blocksMovement,
                     boolean visitable, boolean blockedVisitable, boolean removable) {
        this.objectType = objectType;
        this.position = position;
        this.blocksMovement = blocksMovement;
        this.visitable = visitable;
        this.blockedVisitable = blockedVisitable;
        this.removable = removable;
    }

    /**
     * Non-blocking, non-visitable scenery.
     */
    public static MapObject decorative(Position position) {
        return new MapObject(MapObjectType.DECORATIVE, position, false, false, false, true);
    }

    /**
     * Scenery that blocks its cell, such as a tree or a boulder.
     */
    public static MapObject obstacle(Position position) {
        return new MapObject(MapObjectType.OBSTACLE, position, true, false, false, true);
    }

    public boolean blocksMovement() {
        return blocksMovement;
    }

    /**
     * Cells this object occupies: its anchor when it blocks movement, nothing otherwise.
     */
    public Set<Position> getBlockedPositions() {
        Set<Position> blocked = new LinkedHashSet<>();
        if (blocksMovement) {
            blocked.add(position);
        }
        return blocked;
    }

    /**
     * Cells from which a hero can interact with this object. The 8-neighborhood is not
     * clipped to the map; {@link GameMap} skips cells outside its bounds.
     */
    public Set<Position> getVisitablePositions() {
        Set<Position> visitablePositions = new LinkedHashSet<>();
        if (!visitable) {
            return visitablePositions;
        }
        if (blockedVisitable) {
            visitablePositions.addAll(position.neighbors());
        } else {
            visitablePositions.add(position);
        }
        return visitablePositions;
    }

    public boolean isVisitableAt(Position pos) {
        return visitable && getVisitablePositions().contains(pos);
    }

    public boolean isBlockingAt(Position pos) {
        return blocksMovement && getBlockedPositions().contains(pos);
    }

    public void setOwner(PlayerColor owner) {
        this.owner = owner != null ? owner : PlayerColor.NEUTRAL;
    }

    public boolean isOwnedBy(PlayerColor color) {
        return owner == color;
    }

    @Override
    public String toString() {
        String name = instanceName != null && !instanceName.isEmpty() ? instanceName : objectType.name();
        return name + " at " + position + " (Owner: " + owner + ")";
    }
}
