package com.eldor.service;

import com.eldor.config.DwellingDefinition;
import com.eldor.config.MineDefinition;
import com.eldor.config.ObstacleDefinition;
import com.eldor.config.ResourceDefinition;
import com.eldor.model.DwellingObject;
import com.eldor.model.MapObject;
import com.eldor.model.MineObject;
import com.eldor.model.Position;
import com.eldor.model.ResourceObject;
import org.springframework.stereotype.Component;

/**
 * Turns authored object definitions into map objects, one method per object variant.
 */
@Component
public class MapObjectFactory {

    static final int DEFAULT_RESOURCE_AMOUNT = 500;
    static final int DEFAULT_WEEKLY_GROWTH = 10;

    public ResourceObject createResource(ResourceDefinition def) {
        requireType(def.resourceType(), "Resource", def.x(), def.y());
        int amount = def.amount() > 0 ? def.amount() : DEFAULT_RESOURCE_AMOUNT;
        return new ResourceObject(new Position(def.x(), def.y()), def.resourceType(), amount);
    }

    public MineObject createMine(MineDefinition def) {
        requireType(def.resourceType(), "Mine", def.x(), def.y());
        int production = def.dailyProduction() > 0 ? def.dailyProduction() : 1;
        MineObject mine = new MineObject(new Position(def.x(), def.y()), def.resourceType(), production);
        mine.setOwner(def.owner());
        return mine;
    }

    public DwellingObject createDwelling(DwellingDefinition def) {
        int growth = def.weeklyGrowth() > 0 ? def.weeklyGrowth() : DEFAULT_WEEKLY_GROWTH;
        int initial = def.initialCount() > 0 ? def.initialCount() : growth;
        DwellingObject dwelling = new DwellingObject(new Position(def.x(), def.y()), def.creatureId(), initial, growth);
        if (def.name() != null && !def.name().isBlank()) {
            dwelling.setInstanceName(def.name());
        }
        return dwelling;
    }

    public MapObject createObstacle(ObstacleDefinition def) {
        Position position = new Position(def.x(), def.y());
        MapObject obstacle = def.blocking() ? MapObject.obstacle(position) : MapObject.decorative(position);
        if (def.name() != null) {
            obstacle.setInstanceName(def.name());
        }
        return obstacle;
    }

    private void requireType(Object resourceType, String kind, int x, int y) {
        if (resourceType == null) {
            throw new IllegalArgumentException(kind + " at (" + x + ", " + y + ") has no resource type");
        }
    }
}
