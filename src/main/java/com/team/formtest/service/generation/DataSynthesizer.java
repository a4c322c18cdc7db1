package com.team.formtest.service.generation;

import com.team.formtest.config.GenerationConfig;
import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.form.FormMetadata;
import com.team.formtest.model.form.SemanticType;
import com.team.formtest.model.generation.ExpectedOutcome;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.Scenario;
import com.team.formtest.service.catalog.ConstraintChecker;
import com.team.formtest.service.catalog.FieldTypeCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Entry point for test data. Chooses between the AI and the rule-based generator
 * and falls back to rules whenever the AI path fails or returns unusable data.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DataSynthesizer {

    private final RuleBasedValueGenerator ruleBasedGenerator;
    private final AiValueGenerator aiGenerator;
    private final FieldTypeCatalog catalog;
    private final GenerationConfig config;

    /**
     * All values for a scenario, several per field for boundary ranges.
     * Same metadata, scenario and seed always give the same result on the rule-based path.
     */
    public List<GeneratedValue> synthesize(FormMetadata metadata, Scenario scenario, long seed) {
        if (config.isAiEnabled() && aiGenerator.isAvailable()) {
            try {
                List<GeneratedValue> aiValues = aiGenerator.generate(metadata, scenario, seed);
                validateAiValues(metadata, scenario, aiValues);
                return aiValues;
            } catch (Exception e) {
                log.warn("GenerationFallback: AI generation failed for form {} ({}), using rules: {}",
                        metadata.getId(), scenario, e.getMessage());
            }
        }
        return ruleBasedGenerator.generate(metadata, scenario, seed);
    }

    /**
     * The values one run applies: exactly one per field, in form order. Boundary runs
     * use the first inclusive (accepted) variant of each field.
     */
    public List<GeneratedValue> planRun(FormMetadata metadata, Scenario scenario, long seed) {
        Map<String, GeneratedValue> chosen = new LinkedHashMap<>();
        for (GeneratedValue value : synthesize(metadata, scenario, seed)) {
            GeneratedValue current = chosen.get(value.getFieldName());
            if (current == null) {
                chosen.put(value.getFieldName(), value);
            } else if (scenario == Scenario.BOUNDARY
                    && current.getExpectedOutcome() != ExpectedOutcome.ACCEPT
                    && value.getExpectedOutcome() == ExpectedOutcome.ACCEPT) {
                chosen.put(value.getFieldName(), value);
            }
        }
        List<GeneratedValue> plan = new ArrayList<>();
        for (FieldSpec field : metadata.getFields()) {
            plan.add(chosen.get(field.getName()));
        }
        return plan;
    }

    /**
     * Seed for a new run: the configured fixed seed, or a fresh random one.
     */
    public long nextSeed() {
        return config.getFixedSeed() != null ? config.getFixedSeed() : ThreadLocalRandom.current().nextLong();
    }

    private void validateAiValues(FormMetadata metadata, Scenario scenario, List<GeneratedValue> values) {
        for (FieldSpec field : metadata.getFields()) {
            List<GeneratedValue> forField = values.stream()
                    .filter(v -> field.getName().equals(v.getFieldName()))
                    .toList();
            if (forField.isEmpty()) {
                throw new IllegalStateException("no value for field " + field.getName());
            }
            if (scenario != Scenario.VALID) {
                continue;
            }
            SemanticType type = catalog.resolve(field).getSemanticType();
            for (GeneratedValue value : forField) {
                if (value.getValue() == null || !ConstraintChecker.satisfies(field, type, value.getValue())) {
                    throw new IllegalStateException("value for field " + field.getName() + " breaks its constraints");
                }
            }
        }
    }
}
