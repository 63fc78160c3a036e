package dev.leaddispatch.model;

import java.util.Optional;

/**
 * A known location. Unknown locations are represented by the absence of a
 * {@code GeoPoint} (an empty {@link Optional}), never by a sentinel value.
 */
public record GeoPoint(double latitude, double longitude) {

    public GeoPoint {
        if (!isInRange(latitude, longitude)) {
            throw new IllegalArgumentException(
                    "Coordinates out of range: " + latitude + ", " + longitude);
        }
    }

    /**
     * Build a point from nullable stored values.
     * Missing values, out-of-range values and the legacy (0, 0) "unknown"
     * marker all yield an empty result.
     */
    public static Optional<GeoPoint> of(Double latitude, Double longitude) {
        if (latitude == null || longitude == null) {
            return Optional.empty();
        }
        if (latitude == 0.0 && longitude == 0.0) {
            return Optional.empty();
        }
        if (!isInRange(latitude, longitude)) {
            return Optional.empty();
        }
        return Optional.of(new GeoPoint(latitude, longitude));
    }

    public static boolean isInRange(double latitude, double longitude) {
        return latitude >= -90 && latitude <= 90 && longitude >= -180 && longitude <= 180;
    }
}
