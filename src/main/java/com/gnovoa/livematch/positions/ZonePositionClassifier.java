package com.gnovoa.livematch.positions;

/**
 * Picks the highest priority zone containing the coordinate. Ties go to the zone listed first;
 * coordinates outside every zone classify as {@link #FALLBACK_CODE}.
 */
public final class ZonePositionClassifier implements PositionClassifier {

    private final PositionZoneCatalog catalog;

    public ZonePositionClassifier(PositionZoneCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public String classify(double x, double y) {
        PositionZone best = null;
        for (PositionZone z : catalog.zones()) {
            if (z.contains(x, y) && (best == null || z.priority() > best.priority())) best = z;
        }
        return best == null ? FALLBACK_CODE : best.code();
    }
}
