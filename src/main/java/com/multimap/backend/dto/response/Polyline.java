package com.multimap.backend.dto.response;

public record Polyline(String encodedPolyline) {}
