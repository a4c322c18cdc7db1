package com.team.formtest.exception;

/**
 * A declared field type has no entry in the field type catalog.
 * Always recovered by falling back to the generic text rules.
 */
public class UnsupportedFieldTypeException extends RuntimeException {

    private final String typeName;

    public UnsupportedFieldTypeException(String typeName) {
        super("Unsupported field type: " + typeName);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
