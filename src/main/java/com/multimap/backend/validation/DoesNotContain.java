package com.multimap.backend.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 문자열에 지정한 값이 (대소문자 구분) 포함되어 있으면 실패.
 * null 은 통과시킨다 - 필수 여부는 {@code @NotNull}/{@code @NotEmpty} 로 따로 건다.
 */
@Documented
@Constraint(validatedBy = DoesNotContainValidator.class)
@Target({ElementType.FIELD, ElementType.PARAMETER, ElementType.RECORD_COMPONENT})
@Retention(RetentionPolicy.RUNTIME)
public @interface DoesNotContain {

    String value();

    String message() default "must not contain '{value}'";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
