package com.multimap.backend.dto.google;

/**
 * places:searchText 요청 바디.
 * maxResultCount 는 문자열로 보낸다 ("10").
 */
public record GoogleTextSearchRequest(
        String textQuery,
        String maxResultCount
) {
    public static GoogleTextSearchRequest of(String textQuery, int maxResultCount) {
        return new GoogleTextSearchRequest(textQuery, String.valueOf(maxResultCount));
    }
}
