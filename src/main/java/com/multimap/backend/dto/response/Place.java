// dto/response/Place.java
package com.multimap.backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.multimap.backend.dto.Coordinate;
import com.multimap.backend.dto.google.GooglePlace;

/**
 * 클라이언트에 내려주는 장소 1건.
 * priceLevel 처럼 구글이 생략한 선택 필드는 기본값을 채우지 않고 그대로 생략한다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Place(
        String id,
        String formattedAddress,
        String priceLevel,
        DisplayName displayName,
        Coordinate location
) {
    public static Place from(GooglePlace p) {
        return new Place(
                p.id(),
                p.formattedAddress(),
                p.priceLevel(),
                new DisplayName(p.displayName().text(), p.displayName().languageCode()),
                new Coordinate(p.location().latitude(), p.location().longitude())
        );
    }
}
