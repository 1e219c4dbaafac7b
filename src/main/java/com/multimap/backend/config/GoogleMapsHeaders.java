package com.multimap.backend.config;

/**
 * Google Maps Platform 공통 헤더 이름
 */
public final class GoogleMapsHeaders {

    public static final String API_KEY = "X-Goog-Api-Key";
    public static final String FIELD_MASK = "X-Goog-FieldMask";

    private GoogleMapsHeaders() {
    }
}
