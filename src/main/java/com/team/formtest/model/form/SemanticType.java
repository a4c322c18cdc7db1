package com.team.formtest.model.form;

import com.team.formtest.exception.UnsupportedFieldTypeException;

import java.util.Locale;

/**
 * Semantic type of a form field, as reported by the extraction subsystem.
 */
public enum SemanticType {
    TEXT("text"),
    EMAIL("email"),
    PHONE("phone"),
    PASSWORD("password"),
    NUMBER("number"),
    DATE("date"),
    TIME("time"),
    DATETIME("datetime"),
    URL("url"),
    TEXTAREA("textarea"),
    CHECKBOX("checkbox"),
    RADIO("radio"),
    SELECT("select"),
    MULTI_SELECT("multiSelect"),
    FILE("file"),
    HIDDEN("hidden");

    private final String value;

    SemanticType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Resolve a declared type name ("email", "multi-select", "TEXT" ...).
     *
     * @throws UnsupportedFieldTypeException when the name has no catalog entry
     */
    public static SemanticType fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new UnsupportedFieldTypeException(String.valueOf(name));
        }
        String normalized = name.trim().replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
        for (SemanticType type : values()) {
            if (type.value.toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new UnsupportedFieldTypeException(name);
    }
}
