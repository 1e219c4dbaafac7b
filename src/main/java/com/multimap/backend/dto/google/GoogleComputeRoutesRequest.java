// dto/google/GoogleComputeRoutesRequest.java
package com.multimap.backend.dto.google;

import com.multimap.backend.config.GoogleMapsProperties;
import com.multimap.backend.dto.request.RouteRequest;
import com.multimap.backend.dto.Coordinate;

/**
 * directions/v2:computeRoutes 요청 바디.
 * 출발/도착/출발시각만 클라이언트 값이고 나머지는 설정값(google.maps.routes.*) 고정.
 */
public record GoogleComputeRoutesRequest(
        Waypoint origin,
        Waypoint destination,
        String departureTime,
        String travelMode,
        String routingPreference,
        boolean computeAlternativeRoutes,
        RouteModifiers routeModifiers,
        String languageCode,
        String units
) {

    public static GoogleComputeRoutesRequest of(RouteRequest req, GoogleMapsProperties.Routes opts) {
        return new GoogleComputeRoutesRequest(
                Waypoint.at(req.originLocation()),
                Waypoint.at(req.destinationLocation()),
                req.departureTime(),
                opts.getTravelMode(),
                opts.getRoutingPreference(),
                opts.isComputeAlternativeRoutes(),
                new RouteModifiers(opts.isAvoidTolls(), opts.isAvoidHighways(), opts.isAvoidFerries()),
                opts.getLanguageCode(),
                opts.getUnits()
        );
    }

    // {"location":{"latLng":{...}}}
    public record Waypoint(Location location) {
        static Waypoint at(Coordinate c) {
            return new Waypoint(new Location(new LatLng(c.latitude(), c.longitude())));
        }
    }

    public record Location(LatLng latLng) {}

    public record RouteModifiers(
            boolean avoidTolls,
            boolean avoidHighways,
            boolean avoidFerries
    ) {}
}
