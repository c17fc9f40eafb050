package com.eldor.model;

/**
 * Kinds of objects that can be placed on the adventure map.
 */
public enum MapObjectType {
    HERO,
    TOWN,
    MONSTER,
    RESOURCE,
    MINE,
    ARTIFACT,
    TREASURE_CHEST,
    SHRINE,
    DWELLING,
    GARRISON,
    LIGHTHOUSE,
    SHIPYARD,
    OBELISK,
    DECORATIVE,
    OBSTACLE
}
