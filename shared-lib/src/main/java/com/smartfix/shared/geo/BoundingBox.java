package com.smartfix.shared.geo;

import lombok.Value;

@Value
public class BoundingBox {

    double minLatitude;
    double maxLatitude;
    double minLongitude;
    double maxLongitude;

    public boolean contains(GeoPoint point) {
        return point.getLatitude() >= minLatitude && point.getLatitude() <= maxLatitude
                && point.getLongitude() >= minLongitude && point.getLongitude() <= maxLongitude;
    }
}
