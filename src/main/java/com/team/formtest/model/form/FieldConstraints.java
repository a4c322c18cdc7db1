package com.team.formtest.model.form;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Validation rules extracted for one field. Every dimension is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldConstraints {

    private Integer minLength;      // inclusive
    private Integer maxLength;      // inclusive
    private String pattern;         // full-match regex
    private Double minValue;        // inclusive
    private Double maxValue;        // inclusive

    @Builder.Default
    private List<String> options = new ArrayList<>();  // allowed values for radio/select

    public static FieldConstraints none() {
        return new FieldConstraints();
    }

    public boolean hasPattern() {
        return pattern != null && !pattern.isBlank();
    }

    public boolean hasLengthRange() {
        return minLength != null || maxLength != null;
    }

    public boolean hasValueRange() {
        return minValue != null || maxValue != null;
    }

    public boolean hasOptions() {
        return options != null && !options.isEmpty();
    }
}
