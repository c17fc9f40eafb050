package com.eldor.model;

import lombok.Getter;

/**
 * A capturable mine producing resources for its owner every day. Visited from an adjacent cell.
 */
@Getter
public class MineObject extends MapObject {

    private final ResourceType resourceType;
    private final int dailyProduction;

    public MineObject(Position position, ResourceType resourceType, int dailyProduction) {
        super(MapObjectType.MINE, position, true, true, true, false);
        this.resourceType = resourceType;
        this.dailyProduction = dailyProduction;
        setInstanceName(resourceType + " Mine");
    }

    public MineObject(Position position, ResourceType resourceType) {
        this(position, resourceType, 1);
    }

    /**
     * Flags the mine for the visiting hero's owner.
     */
    public void capture(PlayerColor newOwner) {
        setOwner(newOwner);
    }
}
