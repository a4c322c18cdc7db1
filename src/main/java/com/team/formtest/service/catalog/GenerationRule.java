package com.team.formtest.service.catalog;

import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.Scenario;

import java.util.List;

/**
 * Produces the values of one field for one scenario. Boundary rules may return several
 * values; the other scenarios return exactly one (possibly not-applicable).
 */
@FunctionalInterface
public interface GenerationRule {

    List<GeneratedValue> generate(FieldSpec field, Scenario scenario, GenerationContext context);
}
