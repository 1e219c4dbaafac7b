package com.multimap.backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.multimap.backend.dto.google.GooglePlacesResponse;

import java.util.List;

/**
 * places 가 null 이면 "검색 결과 없음" - 빈 배열로 바꾸지 않고 null 그대로 내려준다.
 */
public record PlacesResponse(
        @JsonInclude(JsonInclude.Include.ALWAYS) List<Place> places
) {
    public static PlacesResponse from(GooglePlacesResponse res) {
        if (res.places() == null) {
            return new PlacesResponse(null);
        }
        return new PlacesResponse(res.places().stream().map(Place::from).toList());
    }
}
