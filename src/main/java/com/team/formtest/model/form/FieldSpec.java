package com.team.formtest.model.form;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Metadata of one form input, independent of any page instance.
 * Produced by the extraction subsystem and never mutated afterwards.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldSpec {

    private String name;            // HTML name/id, unique within the form
    private String label;           // human readable label, may be empty
    private String type;            // declared semantic type name, see SemanticType
    private boolean required;
    private String locator;         // selector handed to the browser as-is
    private String defaultValue;

    @Builder.Default
    private FieldConstraints constraints = FieldConstraints.none();

    public FieldConstraints constraintsOrEmpty() {
        return constraints != null ? constraints : FieldConstraints.none();
    }
}
