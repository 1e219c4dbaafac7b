package com.multimap.backend.dto.request;

import com.multimap.backend.validation.DoesNotContain;
import jakarta.validation.constraints.NotEmpty;

/**
 * 장소 텍스트 검색 요청.
 * 프론트에서 값이 비어 있으면 "undefined" 문자열이 그대로 넘어오는 경우가 있어 막는다.
 */
public record PlaceSearchRequest(
        @NotEmpty
        @DoesNotContain(PlaceSearchRequest.UNSET_SENTINEL)
        String textQuery
) {
    public static final String UNSET_SENTINEL = "undefined";
}
