package com.multimap.backend.dto;

import jakarta.validation.constraints.NotNull;

public record Coordinate(
        @NotNull Float latitude,
        @NotNull Float longitude
) {}
