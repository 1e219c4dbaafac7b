// config/GoogleMapsProperties.java
package com.multimap.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Google Maps Platform 연동 설정 (google.maps.*)
 * - apiKey 는 필수: 없으면 컨텍스트 기동 자체가 실패한다 (서버 포트 바인딩 전)
 * - URL / field mask / 경로 옵션은 기본값이 있고 yml 로 덮어쓸 수 있음
 */
@Getter @Setter
@Validated
@ConfigurationProperties(prefix = "google.maps")
public class GoogleMapsProperties {

    @NotBlank
    private String apiKey;

    @Valid
    private Places places = new Places();

    @Valid
    private Routes routes = new Routes();

    @Getter @Setter
    public static class Places {
        @NotBlank
        private String url = "https://places.googleapis.com/v1/places:searchText";
        @NotBlank
        private String fieldMask = "places.id,places.displayName,places.formattedAddress,places.location";
        private int maxResultCount = 10;
    }

    @Getter @Setter
    public static class Routes {
        @NotBlank
        private String url = "https://routes.googleapis.com/directions/v2:computeRoutes";
        @NotBlank
        private String fieldMask = "routes.duration,routes.distanceMeters,routes.polyline.encodedPolyline";

        // --- 고정 경로 옵션 ---
        private String travelMode = "DRIVE";
        private String routingPreference = "TRAFFIC_AWARE_OPTIMAL";
        private boolean computeAlternativeRoutes = true;
        private boolean avoidTolls = false;
        private boolean avoidHighways = false;
        private boolean avoidFerries = false;
        private String languageCode = "en-US";
        private String units = "METRIC";
    }
}
