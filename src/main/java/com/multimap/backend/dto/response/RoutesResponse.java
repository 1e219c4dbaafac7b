package com.multimap.backend.dto.response;

import com.multimap.backend.dto.google.GoogleRoutesResponse;

import java.util.List;

public record RoutesResponse(List<Route> routes) {

    // 후보 경로는 구글이 준 순서 그대로, 선택/정렬하지 않음
    public static RoutesResponse from(GoogleRoutesResponse res) {
        if (res.routes() == null) {
            return new RoutesResponse(List.of());
        }
        return new RoutesResponse(res.routes().stream().map(Route::from).toList());
    }
}
