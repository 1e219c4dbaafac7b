package com.multimap.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.multimap.backend.config.GoogleMapsProperties;
import com.multimap.backend.config.WebClientConfig;
import com.multimap.backend.dto.request.RouteRequest;
import com.multimap.backend.dto.Coordinate;
import com.multimap.backend.dto.response.Polyline;
import com.multimap.backend.dto.response.Route;
import com.multimap.backend.exception.UpstreamException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class RouteServiceTest {

    private static final RouteRequest GOOGLEPLEX_HOP = new RouteRequest(
            new Coordinate(37.419734f, -122.0827784f),
            new Coordinate(37.41767f, -122.079595f),
            "2023-10-15T15:01:23.045123456Z"
    );

    private MockWebServer google;
    private RouteService routeService;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        google = new MockWebServer();
        google.start();
        routeService = serviceFor(google.url("/directions/v2:computeRoutes").toString());
    }

    @AfterEach
    void tearDown() throws IOException {
        google.shutdown();
    }

    private static RouteService serviceFor(String url) {
        GoogleMapsProperties props = new GoogleMapsProperties();
        props.setApiKey("test-key-1234");
        props.getRoutes().setUrl(url);
        return new RouteService(new WebClientConfig().googleMapsWebClient(props), props);
    }

    private static MockResponse json(String body) {
        return new MockResponse()
                .setHeader("Content-Type", "application/json")
                .setBody(body);
    }

    @Test
    void returnsEveryCandidateInProviderOrder() throws Exception {
        google.enqueue(json("""
                {"routes":[
                  {"distanceMeters":772,"duration":"165s","polyline":{"encodedPolyline":"ipkcFfichVnP@j@BLoFVwM"}},
                  {"distanceMeters":1024.5,"duration":"210s","polyline":{"encodedPolyline":"abcDEF"}},
                  {"distanceMeters":900,"duration":"180s","polyline":{"encodedPolyline":"xyz"},"legs":[]}
                ]}
                """));

        StepVerifier.create(routeService.computeRoutes(GOOGLEPLEX_HOP))
                .assertNext(res -> assertThat(res.routes()).containsExactly(
                        new Route(772f, "165s", new Polyline("ipkcFfichVnP@j@BLoFVwM")),
                        new Route(1024.5f, "210s", new Polyline("abcDEF")),
                        new Route(900f, "180s", new Polyline("xyz"))
                ))
                .verifyComplete();

        RecordedRequest recorded = google.takeRequest(1, TimeUnit.SECONDS);
        assertThat(recorded.getMethod()).isEqualTo("POST");
        assertThat(recorded.getHeader("X-Goog-Api-Key")).isEqualTo("test-key-1234");
        assertThat(recorded.getHeader("X-Goog-FieldMask"))
                .isEqualTo("routes.duration,routes.distanceMeters,routes.polyline.encodedPolyline");
        assertThat(recorded.getHeader("Content-Type")).startsWith("application/json");

        JsonNode body = objectMapper.readTree(recorded.getBody().readUtf8());
        assertThat(body.at("/origin/location/latLng/latitude").floatValue()).isEqualTo(37.419734f);
        assertThat(body.at("/destination/location/latLng/longitude").floatValue()).isEqualTo(-122.079595f);
        assertThat(body.get("departureTime").asText()).isEqualTo("2023-10-15T15:01:23.045123456Z");
        assertThat(body.get("travelMode").asText()).isEqualTo("DRIVE");
        assertThat(body.get("routingPreference").asText()).isEqualTo("TRAFFIC_AWARE_OPTIMAL");
        assertThat(body.get("computeAlternativeRoutes").asBoolean()).isTrue();
        assertThat(body.get("units").asText()).isEqualTo("METRIC");
    }

    @Test
    void noRouteFoundMapsToEmptyList() {
        google.enqueue(json("{}"));

        StepVerifier.create(routeService.computeRoutes(GOOGLEPLEX_HOP))
                .assertNext(res -> assertThat(res.routes()).isEmpty())
                .verifyComplete();
    }

    @Test
    void routeWithoutPolylineIsUpstreamError() {
        google.enqueue(json("{\"routes\":[{\"distanceMeters\":10,\"duration\":\"5s\"}]}"));

        StepVerifier.create(routeService.computeRoutes(GOOGLEPLEX_HOP))
                .expectError(UpstreamException.class)
                .verify();
    }

    @Test
    void nullDurationIsUpstreamError() {
        google.enqueue(json("{\"routes\":[{\"distanceMeters\":10,\"duration\":null,\"polyline\":{\"encodedPolyline\":\"xyz\"}}]}"));

        StepVerifier.create(routeService.computeRoutes(GOOGLEPLEX_HOP))
                .expectError(UpstreamException.class)
                .verify();
    }

    @Test
    void providerErrorStatusFailsWithoutRetry() {
        google.enqueue(new MockResponse().setResponseCode(500));
        google.enqueue(json("{\"routes\":[]}"));

        StepVerifier.create(routeService.computeRoutes(GOOGLEPLEX_HOP))
                .expectError(UpstreamException.class)
                .verify();

        assertThat(google.getRequestCount()).isEqualTo(1);
    }

    @Test
    void connectionRefusedIsUpstreamError() throws IOException {
        MockWebServer gone = new MockWebServer();
        gone.start();
        String url = gone.url("/directions/v2:computeRoutes").toString();
        gone.shutdown();

        StepVerifier.create(serviceFor(url).computeRoutes(GOOGLEPLEX_HOP))
                .expectError(UpstreamException.class)
                .verify();
    }
}
