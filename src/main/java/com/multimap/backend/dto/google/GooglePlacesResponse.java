package com.multimap.backend.dto.google;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * places:searchText 응답. 결과가 없으면 places 필드 자체가 없다 (null).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GooglePlacesResponse(List<GooglePlace> places) {}
