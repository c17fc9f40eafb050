package com.eldor.model;

import lombok.Getter;

/**
 * A pile of resources a hero picks up by stepping onto it. Does not block movement.
 */
@Getter
public class ResourceObject extends MapObject {

    private final ResourceType resourceType;
    private final int amount;

    public ResourceObject(Position position, ResourceType resourceType, int amount) {
        super(MapObjectType.RESOURCE, position, false, true, false, true);
        this.resourceType = resourceType;
        this.amount = amount;
        setInstanceName(resourceType + " Pile");
    }
}
