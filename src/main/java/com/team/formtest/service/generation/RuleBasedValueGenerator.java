package com.team.formtest.service.generation;

import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.form.FormMetadata;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.Scenario;
import com.team.formtest.service.catalog.FieldRules;
import com.team.formtest.service.catalog.FieldTypeCatalog;
import com.team.formtest.service.catalog.GenerationContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Deterministic generator driven by the field type catalog.
 * Each field draws from its own random stream derived from (seed, position, scenario),
 * so adding a field never shifts the values of the fields before it.
 */
@Component
public class RuleBasedValueGenerator implements ValueGenerator {

    private final FieldTypeCatalog catalog;
    private final Clock clock;

    @Autowired
    public RuleBasedValueGenerator(FieldTypeCatalog catalog) {
        this(catalog, Clock.systemDefaultZone());
    }

    public RuleBasedValueGenerator(FieldTypeCatalog catalog, Clock clock) {
        this.catalog = catalog;
        this.clock = clock;
    }

    @Override
    public List<GeneratedValue> generate(FormMetadata metadata, Scenario scenario, long seed) {
        LocalDate today = LocalDate.now(clock);
        List<GeneratedValue> values = new ArrayList<>();
        List<FieldSpec> fields = metadata.getFields();
        for (int i = 0; i < fields.size(); i++) {
            values.addAll(generateField(fields.get(i), scenario, new GenerationContext(fieldRandom(seed, i, scenario), today)));
        }
        return values;
    }

    public List<GeneratedValue> generateField(FieldSpec field, Scenario scenario, GenerationContext context) {
        FieldRules rules = catalog.resolve(field);
        return rules.getGenerationRule().generate(field, scenario, context);
    }

    private static Random fieldRandom(long seed, int position, Scenario scenario) {
        long mixed = seed * 0x9E3779B97F4A7C15L + (position + 1L) * 0xBF58476D1CE4E5B9L + scenario.ordinal();
        return new Random(mixed);
    }
}
