package com.smartfix.request.gateway;

import com.smartfix.request.entity.ServiceProvider;
import com.smartfix.shared.geo.GeoPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.geo.Circle;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.GeoResults;
import org.springframework.data.geo.Metrics;
import org.springframework.data.geo.Point;
import org.springframework.data.redis.connection.RedisGeoCommands;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Redis GEO set of provider service-area centres, used as the radius prefilter.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderGeoIndex {

    static final String GEO_KEY = "providers:geo";

    private final RedisTemplate<String, String> redisTemplate;

    public void index(ServiceProvider provider) {
        if (provider.getServiceArea() == null) {
            return;
        }
        GeoPoint center = provider.getServiceArea().toPoint();
        redisTemplate.opsForGeo().add(GEO_KEY,
                new Point(center.getLongitude(), center.getLatitude()), provider.getId());
    }

    /**
     * Provider ids within {@code radiusKm} of {@code center}, nearest first.
     */
    public List<String> within(GeoPoint center, double radiusKm) {
        Circle circle = new Circle(
                new Point(center.getLongitude(), center.getLatitude()),
                new Distance(radiusKm, Metrics.KILOMETERS)
        );

        GeoResults<RedisGeoCommands.GeoLocation<String>> results = redisTemplate.opsForGeo().radius(
                GEO_KEY,
                circle,
                RedisGeoCommands.GeoRadiusCommandArgs.newGeoRadiusArgs().sortAscending()
        );

        if (results == null) {
            return List.of();
        }

        List<String> ids = new ArrayList<>();
        results.forEach(r -> ids.add(r.getContent().getName()));
        log.debug("Geo index: {} providers within {}km of ({}, {})",
                ids.size(), radiusKm, center.getLatitude(), center.getLongitude());
        return ids;
    }
}
