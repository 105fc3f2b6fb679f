package com.smartfix.shared.geo;

import lombok.Value;

/**
 * WGS84 point. Longitude first, matching GeoJSON and the Redis GEO commands.
 */
@Value
public class GeoPoint {

    double longitude;
    double latitude;

    public static GeoPoint of(double longitude, double latitude) {
        return new GeoPoint(longitude, latitude);
    }
}
