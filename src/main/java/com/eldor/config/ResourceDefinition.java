package com.eldor.config;

import com.eldor.model.ResourceType;

/**
 * A resource pile placed on the map.
 */
public record ResourceDefinition(
        int x,
        int y,
        ResourceType resourceType,
        int amount
) {}
