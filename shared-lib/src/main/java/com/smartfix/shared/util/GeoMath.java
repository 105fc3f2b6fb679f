package com.smartfix.shared.util;

import com.smartfix.shared.geo.BoundingBox;
import com.smartfix.shared.geo.GeoPoint;

/**
 * Great-circle helpers for service-area and travel-distance checks.
 * All distances are in kilometres.
 */
public final class GeoMath {

    public static final double EARTH_RADIUS_KM = 6371.0;

    // Widens the box so rounding never drops a point on the circle's edge
    private static final double BOX_MARGIN = 1.01;

    private GeoMath() {}

    /**
     * Haversine distance. Symmetric, and zero for identical points.
     */
    public static double distanceKm(GeoPoint a, GeoPoint b) {
        return distanceKm(a.getLatitude(), a.getLongitude(), b.getLatitude(), b.getLongitude());
    }

    public static double distanceKm(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Lat/lng box enclosing the circle. A superset prefilter only; callers still
     * apply {@link #distanceKm} for the exact test.
     */
    public static BoundingBox boundingBox(GeoPoint center, double radiusKm) {
        double latDelta = Math.toDegrees(radiusKm * BOX_MARGIN / EARTH_RADIUS_KM);
        double minLat = Math.max(-90.0, center.getLatitude() - latDelta);
        double maxLat = Math.min(90.0, center.getLatitude() + latDelta);

        double cosLat = Math.cos(Math.toRadians(center.getLatitude()));
        if (minLat <= -90.0 || maxLat >= 90.0 || cosLat < 1e-6) {
            return new BoundingBox(minLat, maxLat, -180.0, 180.0);
        }

        double lngDelta = latDelta / cosLat;
        double minLng = center.getLongitude() - lngDelta;
        double maxLng = center.getLongitude() + lngDelta;
        if (minLng < -180.0 || maxLng > 180.0) {
            // crosses the antimeridian
            return new BoundingBox(minLat, maxLat, -180.0, 180.0);
        }
        return new BoundingBox(minLat, maxLat, minLng, maxLng);
    }
}
