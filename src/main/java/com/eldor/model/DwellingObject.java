package com.eldor.model;

import lombok.Getter;

/**
 * A creature dwelling where heroes recruit troops. Stock grows every week.
 */
@Getter
public class DwellingObject extends MapObject {

    private final int creatureId;
    private int availableCount;
    private final int weeklyGrowth;

    public DwellingObject(Position position, int creatureId, int initialCount, int weeklyGrowth) {
        super(MapObjectType.DWELLING, position, true, true, true, false);
        this.creatureId = creatureId;
        this.availableCount = initialCount;
        this.weeklyGrowth = weeklyGrowth;
        setInstanceName("Creature Dwelling");
    }

    /**
     * A freshly built dwelling starts with one week of growth.
     */
    public DwellingObject(Position position, int creatureId, int weeklyGrowth) {
        this(position, creatureId, weeklyGrowth, weeklyGrowth);
    }

    public void applyWeeklyGrowth() {
        availableCount += weeklyGrowth;
    }

    public boolean canRecruit(int count) {
        return count > 0 && count <= availableCount;
    }

    /**
     * @return false, leaving the stock untouched, when fewer than {@code count} creatures are available
     */
    public boolean recruit(int count) {
        if (!canRecruit(count)) {
            return false;
        }
        availableCount -= count;
        return true;
    }
}
