package dev.leaddispatch.geo;

import dev.leaddispatch.model.GeoPoint;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Great-circle distance between two coordinates (haversine formula).
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private GeoDistance() {
    }

    /**
     * Distance in kilometers between two known points.
     */
    public static double distanceKm(GeoPoint from, GeoPoint to) {
        double lat1 = Math.toRadians(from.latitude());
        double lat2 = Math.toRadians(to.latitude());
        double dLat = Math.toRadians(to.latitude() - from.latitude());
        double dLon = Math.toRadians(to.longitude() - from.longitude());

        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));

        return EARTH_RADIUS_KM * c;
    }

    /**
     * Distance between two possibly unknown points. Empty when either side is
     * unknown; callers must not read that as "zero km".
     */
    public static OptionalDouble distanceKm(Optional<GeoPoint> from, Optional<GeoPoint> to) {
        if (from.isEmpty() || to.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(distanceKm(from.get(), to.get()));
    }

    /**
     * Distance between raw stored coordinates. Missing, out-of-range and
     * (0, 0) pairs are unknown.
     */
    public static OptionalDouble distanceKm(Double lat1, Double lon1, Double lat2, Double lon2) {
        return distanceKm(GeoPoint.of(lat1, lon1), GeoPoint.of(lat2, lon2));
    }
}
