// config/WebClientConfig.java
package com.multimap.backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;

@Slf4j
@Configuration
@EnableConfigurationProperties(GoogleMapsProperties.class)
public class WebClientConfig {

    /**
     * Places / Routes 가 같이 쓰는 WebClient.
     * API key 와 content-type 은 기본 헤더로, field mask 는 호출마다 붙인다.
     */
    @Bean
    public WebClient googleMapsWebClient(GoogleMapsProperties props) {
        log.info("Google Places url = {}", props.getPlaces().getUrl());
        log.info("Google Routes url = {}", props.getRoutes().getUrl());
        log.info("Google Maps apiKey prefix = {}****", keyPrefix(props.getApiKey()));

        return WebClient.builder()
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader(GoogleMapsHeaders.API_KEY, props.getApiKey())
                .exchangeStrategies(
                        ExchangeStrategies.builder()
                                .codecs(c -> c.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
                                .build()
                )
                .build();
    }

    private static String keyPrefix(String apiKey) {
        return apiKey.substring(0, Math.min(4, apiKey.length()));
    }
}
