package com.smartfix.shared.util;

import com.smartfix.shared.geo.BoundingBox;
import com.smartfix.shared.geo.GeoPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Haversine with R = 6371 km.
 */
class GeoMathTest {

    private static final GeoPoint NEW_YORK    = GeoPoint.of(-74.0060, 40.7128);
    private static final GeoPoint LOS_ANGELES = GeoPoint.of(-118.2437, 34.0522);
    private static final GeoPoint LONDON      = GeoPoint.of(-0.1278, 51.5074);
    private static final GeoPoint PARIS       = GeoPoint.of(2.3522, 48.8566);

    @Test
    @DisplayName("Distance from a point to itself is zero")
    void samePointIsZero() {
        assertThat(GeoMath.distanceKm(NEW_YORK, NEW_YORK)).isZero();
    }

    @Test
    @DisplayName("Distance is symmetric")
    void distanceIsSymmetric() {
        assertThat(GeoMath.distanceKm(NEW_YORK, LOS_ANGELES))
                .isEqualTo(GeoMath.distanceKm(LOS_ANGELES, NEW_YORK));
        assertThat(GeoMath.distanceKm(LONDON, PARIS))
                .isEqualTo(GeoMath.distanceKm(PARIS, LONDON));
    }

    @Test
    @DisplayName("New York to Los Angeles is about 3936 km")
    void newYorkToLosAngeles() {
        assertThat(GeoMath.distanceKm(NEW_YORK, LOS_ANGELES)).isCloseTo(3935.7, within(5.0));
    }

    @Test
    @DisplayName("London to Paris is about 344 km")
    void londonToParis() {
        assertThat(GeoMath.distanceKm(LONDON, PARIS)).isCloseTo(343.5, within(1.5));
    }

    @Test
    @DisplayName("Coordinate overload agrees with the point overload")
    void coordinateOverloadMatches() {
        double viaPoints = GeoMath.distanceKm(LONDON, PARIS);
        double viaCoords = GeoMath.distanceKm(51.5074, -0.1278, 48.8566, 2.3522);
        assertThat(viaCoords).isEqualTo(viaPoints);
    }

    @Test
    @DisplayName("One degree of latitude is about 111 km")
    void oneDegreeOfLatitude() {
        assertThat(GeoMath.distanceKm(0, 0, 1, 0)).isCloseTo(111.19, within(0.05));
    }

    @Test
    @DisplayName("Bounding box contains points within the radius in every direction")
    void boundingBoxContainsCircle() {
        GeoPoint center = GeoPoint.of(-73.9857, 40.7484);
        BoundingBox box = GeoMath.boundingBox(center, 20.0);

        double latStep = 19.9 / 111.2;
        double lngStep = 19.9 / (111.2 * Math.cos(Math.toRadians(center.getLatitude())));

        assertThat(box.contains(GeoPoint.of(center.getLongitude(), center.getLatitude() + latStep))).isTrue();
        assertThat(box.contains(GeoPoint.of(center.getLongitude(), center.getLatitude() - latStep))).isTrue();
        assertThat(box.contains(GeoPoint.of(center.getLongitude() + lngStep, center.getLatitude()))).isTrue();
        assertThat(box.contains(GeoPoint.of(center.getLongitude() - lngStep, center.getLatitude()))).isTrue();
        assertThat(box.contains(GeoPoint.of(center.getLongitude(), center.getLatitude() + 1.0))).isFalse();
    }

    @Test
    @DisplayName("Bounding box keeps points just inside the radius")
    void boundingBoxKeepsCircleEdge() {
        GeoPoint center = GeoPoint.of(-73.9857, 40.7484);
        double radiusKm = 20.0;
        BoundingBox box = GeoMath.boundingBox(center, radiusKm);

        // 0.999 of the radius, measured with the same earth radius the distance uses
        double latStep = Math.toDegrees(0.999 * radiusKm / GeoMath.EARTH_RADIUS_KM);
        GeoPoint north = GeoPoint.of(center.getLongitude(), center.getLatitude() + latStep);
        GeoPoint south = GeoPoint.of(center.getLongitude(), center.getLatitude() - latStep);
        assertThat(GeoMath.distanceKm(center, north)).isLessThan(radiusKm);
        assertThat(box.contains(north)).isTrue();
        assertThat(box.contains(south)).isTrue();

        // due east along the parallel, stepping until just inside the circle
        double lngStep = latStep / Math.cos(Math.toRadians(center.getLatitude()));
        while (GeoMath.distanceKm(center, GeoPoint.of(center.getLongitude() + lngStep, center.getLatitude())) < 0.999 * radiusKm) {
            lngStep *= 1.0001;
        }
        GeoPoint east = GeoPoint.of(center.getLongitude() + lngStep, center.getLatitude());
        GeoPoint west = GeoPoint.of(center.getLongitude() - lngStep, center.getLatitude());
        assertThat(GeoMath.distanceKm(center, east)).isLessThan(radiusKm);
        assertThat(box.contains(east)).isTrue();
        assertThat(box.contains(west)).isTrue();
    }

    @Test
    @DisplayName("Bounding box near a pole spans every longitude")
    void boundingBoxNearPole() {
        BoundingBox box = GeoMath.boundingBox(GeoPoint.of(10.0, 89.9), 50.0);
        assertThat(box.getMinLongitude()).isEqualTo(-180.0);
        assertThat(box.getMaxLongitude()).isEqualTo(180.0);
        assertThat(box.getMaxLatitude()).isEqualTo(90.0);
    }

    @Test
    @DisplayName("Bounding box crossing the antimeridian spans every longitude")
    void boundingBoxAcrossAntimeridian() {
        BoundingBox box = GeoMath.boundingBox(GeoPoint.of(179.9, 0.0), 50.0);
        assertThat(box.getMinLongitude()).isEqualTo(-180.0);
        assertThat(box.getMaxLongitude()).isEqualTo(180.0);
        assertThat(box.contains(GeoPoint.of(-179.9, 0.0))).isTrue();
    }
}
