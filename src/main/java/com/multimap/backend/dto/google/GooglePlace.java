// dto/google/GooglePlace.java
package com.multimap.backend.dto.google;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;

/**
 * Places API (New) 의 place 1건. field mask 밖의 필드는 무시한다.
 * required 필드가 빠져 있거나 null 이면 역직렬화 단계에서 실패 -> 업스트림 오류로 처리.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GooglePlace(
        @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) String id,
        @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) String formattedAddress,
        String priceLevel,
        @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) LocalizedText displayName,
        @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) LatLng location
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LocalizedText(
            @JsonProperty(required = true) @JsonSetter(nulls = Nulls.FAIL) String text,
            String languageCode
    ) {}
}
