package com.multimap.backend.dto.request;

import com.multimap.backend.dto.Coordinate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record RouteRequest(
        @NotNull @Valid Coordinate originLocation,
        @NotNull @Valid Coordinate destinationLocation,
        @NotNull String departureTime // ISO-8601, 파싱하지 않고 그대로 전달
) {}
