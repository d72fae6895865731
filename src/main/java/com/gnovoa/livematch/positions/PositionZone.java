package com.gnovoa.livematch.positions;

/** Rectangular pitch area mapped to a position code. Bounds are inclusive. */
public record PositionZone(String code, String name, double minX, double maxX, double minY, double maxY, int priority) {

    public boolean contains(double x, double y) {
        return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }
}
