package com.multimap.backend.dto.google;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

@JsonIgnoreProperties(ignoreUnknown = true)
public record LatLng(
        @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) float latitude,
        @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) float longitude
) {}
