package com.team.formtest.model.form;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracted description of a form: its fields in document order plus the submit control.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormMetadata {

    private String id;              // source identity, e.g. metadata record id
    private String pageUrl;         // page the form lives on
    private String submitLocator;   // selector of the submit control

    @Builder.Default
    private List<FieldSpec> fields = new ArrayList<>();
}
