package com.eldor.model;

public enum ResourceType {
    WOOD,
    MERCURY,
    ORE,
    SULFUR,
    CRYSTAL,
    GEMS,
    GOLD
}
