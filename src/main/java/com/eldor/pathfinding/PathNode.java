package com.eldor.pathfinding;

import com.eldor.model.Position;
import lombok.Getter;
import lombok.Setter;

/**
 * Search node for a single tile. Nodes compare by total estimated cost, then by remaining
 * estimate, so among equally promising nodes the one closer to the goal is expanded first.
 * <p>
 * Equality is identity: the open set tracks node objects, not positions.
 */
@Getter
@Setter
class PathNode implements Comparable<PathNode> {

    private final Position position;
    private PathNode parent;

    /** Accumulated cost from the start. */
    private int gCost;

    /** Heuristic estimate to the goal. */
    private final int hCost;

    PathNode(Position position, PathNode parent, int gCost, int hCost) {
        this.position = position;
        this.parent = parent;
        this.gCost = gCost;
        this.hCost = hCost;
    }

    int getFCost() {
        return gCost + hCost;
    }

    @Override
    public int compareTo(PathNode other) {
        int result = Integer.compare(getFCost(), other.getFCost());
        if (result == 0) {
            result = Integer.compare(hCost, other.hCost);
        }
        return result;
    }

    @Override
    public String toString() {
        return "PathNode" + position + " g=" + gCost + " h=" + hCost;
    }
}
