package com.multimap.backend.dto.google;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * computeRoutes 응답. 경로를 못 찾으면 구글은 빈 객체({})를 준다 -> routes == null.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleRoutesResponse(List<GoogleRoute> routes) {}
