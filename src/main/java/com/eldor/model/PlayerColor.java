package com.eldor.model;

/**
 * Owner colors for heroes and capturable objects.
 */
public enum PlayerColor {
    RED("#e74c3c"),
    BLUE("#3498db"),
    TAN("#d2b48c"),
    GREEN("#2ecc71"),
    ORANGE("#e67e22"),
    PURPLE("#9b59b6"),
    TEAL("#1abc9c"),
    PINK("#fd79a8"),
    NEUTRAL("#95a5a6");

    private final String hexCode;

    PlayerColor(String hexCode) {
        this.hexCode = hexCode;
    }

    public String getHexCode() {
        return hexCode;
    }
}
