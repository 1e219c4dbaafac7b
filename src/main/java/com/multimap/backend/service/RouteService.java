// service/RouteService.java
package com.multimap.backend.service;

import com.multimap.backend.config.GoogleMapsHeaders;
import com.multimap.backend.config.GoogleMapsProperties;
import com.multimap.backend.dto.google.GoogleComputeRoutesRequest;
import com.multimap.backend.dto.google.GoogleRoutesResponse;
import com.multimap.backend.dto.request.RouteRequest;
import com.multimap.backend.dto.response.RoutesResponse;
import com.multimap.backend.exception.UpstreamException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class RouteService {

    private final WebClient googleMapsWebClient;
    private final GoogleMapsProperties props;

    public Mono<RoutesResponse> computeRoutes(RouteRequest query) {
        GoogleMapsProperties.Routes routes = props.getRoutes();
        GoogleComputeRoutesRequest body = GoogleComputeRoutesRequest.of(query, routes);
        log.debug("Routes 계산 요청: {}", body);

        return googleMapsWebClient.post()
                .uri(routes.getUrl())
                .header(GoogleMapsHeaders.FIELD_MASK, routes.getFieldMask())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(GoogleRoutesResponse.class)
                .switchIfEmpty(Mono.error(() -> new UpstreamException("Routes API 응답 바디 없음")))
                .map(RoutesResponse::from)
                .onErrorMap(e -> !(e instanceof UpstreamException),
                        e -> new UpstreamException("Routes API 호출 실패", e))
                .doOnError(e -> log.error("Google Routes API 오류: {}", e.getMessage(), e));
    }
}
