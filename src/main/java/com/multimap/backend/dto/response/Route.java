package com.multimap.backend.dto.response;

import com.multimap.backend.dto.google.GoogleRoute;

public record Route(
        float distanceMeters,
        String duration,      // 구글 포맷 그대로 ("165s")
        Polyline polyline     // 인코딩된 polyline, 디코딩하지 않음
) {
    public static Route from(GoogleRoute r) {
        return new Route(r.distanceMeters(), r.duration(), new Polyline(r.polyline().encodedPolyline()));
    }
}
