package com.smartfix.request.entity;

import com.smartfix.shared.geo.GeoPoint;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Circle a provider is willing to travel within.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceArea {

    @Column(name = "area_center_longitude", nullable = false)
    private double centerLongitude;

    @Column(name = "area_center_latitude", nullable = false)
    private double centerLatitude;

    @Column(name = "area_radius_km", nullable = false)
    private double radiusKm;

    public GeoPoint toPoint() {
        return GeoPoint.of(centerLongitude, centerLatitude);
    }
}
