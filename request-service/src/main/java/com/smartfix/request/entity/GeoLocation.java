package com.smartfix.request.entity;

import com.smartfix.shared.geo.GeoPoint;
import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GeoLocation {

    @Column(name = "longitude", nullable = false)
    private double longitude;

    @Column(name = "latitude", nullable = false)
    private double latitude;

    @Column(name = "address", length = 500)
    private String address;

    public GeoPoint toPoint() {
        return GeoPoint.of(longitude, latitude);
    }
}
