package com.team.formtest.model.generation;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * A concrete value for one field: text, number, boolean or a list of chosen options.
 * Exactly one payload is set, selected by {@link #kind}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FieldValue {

    private Kind kind;
    private String text;
    private BigDecimal number;
    private Boolean flag;
    private List<String> options;

    public enum Kind {
        TEXT,
        NUMBER,
        BOOLEAN,
        OPTIONS
    }

    public static FieldValue ofText(String text) {
        return new FieldValue(Kind.TEXT, text, null, null, null);
    }

    public static FieldValue ofNumber(BigDecimal number) {
        return new FieldValue(Kind.NUMBER, null, number, null, null);
    }

    public static FieldValue ofNumber(long number) {
        return ofNumber(BigDecimal.valueOf(number));
    }

    public static FieldValue ofBoolean(boolean flag) {
        return new FieldValue(Kind.BOOLEAN, null, null, flag, null);
    }

    public static FieldValue ofOptions(List<String> options) {
        return new FieldValue(Kind.OPTIONS, null, null, null, List.copyOf(options));
    }

    /**
     * Text form as typed into an input. Options are joined with commas.
     */
    public String asText() {
        return switch (kind) {
            case TEXT -> text != null ? text : "";
            case NUMBER -> number.stripTrailingZeros().toPlainString();
            case BOOLEAN -> String.valueOf(flag);
            case OPTIONS -> String.join(",", options);
        };
    }

    public boolean asBoolean() {
        if (kind == Kind.BOOLEAN) {
            return Boolean.TRUE.equals(flag);
        }
        String raw = asText().trim().toLowerCase();
        return raw.equals("true") || raw.equals("1") || raw.equals("yes") || raw.equals("checked") || raw.equals("on");
    }

    public List<String> asOptions() {
        if (kind == Kind.OPTIONS) {
            return options;
        }
        String raw = asText();
        return raw.isEmpty() ? List.of() : List.of(raw);
    }
}
