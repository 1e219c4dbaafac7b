package com.multimap.backend.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

public class DoesNotContainValidator implements ConstraintValidator<DoesNotContain, CharSequence> {

    private String needle;

    @Override
    public void initialize(DoesNotContain annotation) {
        this.needle = annotation.value();
    }

    @Override
    public boolean isValid(CharSequence value, ConstraintValidatorContext context) {
        return value == null || !value.toString().contains(needle);
    }
}
