package com.taxidispatch.shared.geo;

/**
 * A position on the dispatch plane: latitude on the first axis, longitude on the second.
 * Coordinates are treated as plain planar values; see {@link com.taxidispatch.shared.util.PlanarDistance}.
 */
public record GeoPoint(double lat, double lng) {

    public static final GeoPoint ORIGIN = new GeoPoint(0.0, 0.0);

    public static GeoPoint of(double lat, double lng) {
        return new GeoPoint(lat, lng);
    }

    @Override
    public String toString() {
        return String.format("(%.4f, %.4f)", lat, lng);
    }
}
