package com.multimap.backend.dto.google;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

/**
 * distanceMeters 는 0 이면 구글이 생략하므로 필수가 아님 (기본 0).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleRoute(
        float distanceMeters,
        @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) String duration,
        @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) EncodedPolyline polyline
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record EncodedPolyline(@JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) String encodedPolyline) {}
}
