package com.multimap.backend.controller;

import com.multimap.backend.dto.request.RouteRequest;
import com.multimap.backend.dto.response.RoutesResponse;
import com.multimap.backend.service.RouteService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Tag(name = "경로 계산", description = "Google Routes 경로 계산 중계 API")
@RestController
@RequiredArgsConstructor
public class RouteController {

    private final RouteService routeService;

    /**
     * POST /routes
     *
     * 자동차 / 실시간 교통 반영 / 대안 경로 포함으로 고정해서 구글에 요청하고,
     * 후보 경로 전부를 순서 그대로 내려준다.
     */
    @Operation(
            summary = "경로 계산",
            description = """
        출발/도착 좌표와 출발 시각(ISO-8601)으로 Google Routes 를 호출합니다.
        각 후보 경로의 거리(m), 소요시간, 인코딩된 polyline 을 돌려줍니다.
        """
    )
    @PostMapping(value = "/routes", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<RoutesResponse> computeRoutes(@Valid @RequestBody RouteRequest request) {
        return routeService.computeRoutes(request);
    }
}
