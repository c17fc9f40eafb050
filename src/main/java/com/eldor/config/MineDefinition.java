package com.eldor.config;

import com.eldor.model.PlayerColor;
import com.eldor.model.ResourceType;

/**
 * A mine placed on the map.
 *
 * @param dailyProduction units produced per day, 1 when omitted
 * @param owner           initial owner, neutral when omitted
 */
public record MineDefinition(
        int x,
        int y,
        ResourceType resourceType,
        int dailyProduction,
        PlayerColor owner
) {}
