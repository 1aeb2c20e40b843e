package com.taxidispatch.shared.util;

import com.taxidispatch.shared.geo.GeoPoint;

/**
 * Distance metric used for both the matching radius and fare computation.
 *
 * Euclidean distance over the raw coordinate axes, reported as kilometres.
 * This is not a geodesic distance; radius and fare semantics are calibrated against it.
 */
public final class PlanarDistance {

    public static final double METERS_PER_KM = 1000.0;

    private PlanarDistance() {}

    public static double between(GeoPoint from, GeoPoint to) {
        return between(from.lat(), from.lng(), to.lat(), to.lng());
    }

    public static double between(double lat1, double lng1, double lat2, double lng2) {
        double dLat = lat2 - lat1;
        double dLng = lng2 - lng1;
        return Math.sqrt(dLat * dLat + dLng * dLng);
    }

    public static double toMeters(double distanceKm) {
        return distanceKm * METERS_PER_KM;
    }

    /**
     * Travel time in minutes at the given average speed; 0 for a non-positive speed.
     */
    public static double travelMinutes(double distanceKm, double speedKmh) {
        if (speedKmh <= 0) {
            return 0.0;
        }
        return distanceKm / speedKmh * 60.0;
    }
}
