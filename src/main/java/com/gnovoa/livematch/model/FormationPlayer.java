package com.gnovoa.livematch.model;

/**
 * One player placed on the pitch. Coordinates are percentages of pitch length ({@code x}, own goal
 * at 0) and width ({@code y}); they may be absent for views derived from the lineup.
 */
public record FormationPlayer(String playerId, String name, String position, Double x, Double y) {

    public FormationPlayer {
        if (playerId == null || playerId.isBlank()) throw new IllegalArgumentException("playerId is required");
        if (x != null && (x < 0 || x > 100)) throw new IllegalArgumentException("Pitch x must be within [0,100]: " + x);
        if (y != null && (y < 0 || y > 100)) throw new IllegalArgumentException("Pitch y must be within [0,100]: " + y);
    }

    public boolean hasCoordinates() {
        return x != null && y != null;
    }

    public FormationPlayer withPosition(String code) {
        return new FormationPlayer(playerId, name, code, x, y);
    }
}
