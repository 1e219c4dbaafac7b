// service/PlaceService.java
package com.multimap.backend.service;

import com.multimap.backend.config.GoogleMapsHeaders;
import com.multimap.backend.config.GoogleMapsProperties;
import com.multimap.backend.dto.google.GooglePlacesResponse;
import com.multimap.backend.dto.google.GoogleTextSearchRequest;
import com.multimap.backend.dto.response.PlacesResponse;
import com.multimap.backend.exception.UpstreamException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@Slf4j
@Service
@RequiredArgsConstructor
public class PlaceService {

    private final WebClient googleMapsWebClient;
    private final GoogleMapsProperties props;

    /**
     * Places API 텍스트 검색 1회 호출 (재시도 없음).
     * 검증은 컨트롤러 경계에서 끝난 상태로 들어온다.
     */
    public Mono<PlacesResponse> searchText(String textQuery) {
        GoogleMapsProperties.Places places = props.getPlaces();
        GoogleTextSearchRequest body = GoogleTextSearchRequest.of(textQuery, places.getMaxResultCount());
        log.debug("Places 검색 요청: {}", body);

        // TODO: locationBias(원형 영역) 지원 - 클라이언트가 현재 위치를 보내기 시작하면 추가
        return googleMapsWebClient.post()
                .uri(places.getUrl())
                .header(GoogleMapsHeaders.FIELD_MASK, places.getFieldMask())
                .bodyValue(body)
                .retrieve()
                .bodyToMono(GooglePlacesResponse.class)
                .switchIfEmpty(Mono.error(() -> new UpstreamException("Places API 응답 바디 없음")))
                .map(PlacesResponse::from)
                .onErrorMap(e -> !(e instanceof UpstreamException),
                        e -> new UpstreamException("Places API 호출 실패", e))
                .doOnError(e -> log.error("Google Places API 오류: {}", e.getMessage(), e));
    }
}
