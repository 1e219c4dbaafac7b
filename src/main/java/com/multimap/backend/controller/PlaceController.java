package com.multimap.backend.controller;

import com.multimap.backend.dto.request.PlaceSearchRequest;
import com.multimap.backend.dto.response.PlacesResponse;
import com.multimap.backend.service.PlaceService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@Tag(name = "장소 검색", description = "Google Places 텍스트 검색 중계 API")
@RestController
@RequiredArgsConstructor
public class PlaceController {

    private final PlaceService placeService;

    /**
     * POST /places
     *
     * textQuery 가 비었거나 "undefined" 를 포함하면 400 (구글 호출 없음).
     * 결과는 최대 10건, 결과가 없으면 places: null.
     */
    @Operation(
            summary = "장소 텍스트 검색",
            description = """
        Google Places 텍스트 검색을 호출해 id / 표시명 / 주소 / 좌표를 돌려줍니다.
        검색 결과가 없으면 places 는 null 입니다.
        """
    )
    @PostMapping(value = "/places", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<PlacesResponse> searchPlaces(@Valid @RequestBody PlaceSearchRequest request) {
        return placeService.searchText(request.textQuery());
    }

    /**
     * GET /places?textQuery=...
     * 초기 버전 클라이언트 호환용. 동작은 POST 와 동일.
     */
    @Operation(summary = "장소 텍스트 검색 (쿼리 파라미터)", description = "POST /places 와 동일, 구버전 클라이언트용")
    @GetMapping(value = "/places", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<PlacesResponse> searchPlacesByQuery(@Valid @ModelAttribute PlaceSearchRequest request) {
        return placeService.searchText(request.textQuery());
    }
}
