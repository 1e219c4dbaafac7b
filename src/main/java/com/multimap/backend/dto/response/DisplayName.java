package com.multimap.backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record DisplayName(
        String text,
        String languageCode // 구글이 안 주면 응답에서도 생략
) {}
