package com.team.formtest.service.generation;

import com.team.formtest.model.form.FormMetadata;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.Scenario;

import java.util.List;

/**
 * Produces scenario-tagged values for every field of a form.
 * Boundary values may yield several variants per field; fields come back in form order.
 */
public interface ValueGenerator {

    List<GeneratedValue> generate(FormMetadata metadata, Scenario scenario, long seed);
}
