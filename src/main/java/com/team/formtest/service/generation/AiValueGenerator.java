package com.team.formtest.service.generation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.team.formtest.config.GenerationConfig;
import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.form.FormMetadata;
import com.team.formtest.model.form.SemanticType;
import com.team.formtest.model.generation.ExpectedOutcome;
import com.team.formtest.model.generation.FieldValue;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.GenerationMethod;
import com.team.formtest.model.generation.Scenario;
import com.team.formtest.service.catalog.FieldTypeCatalog;
import com.team.formtest.service.claude.ClaudeApiService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Asks Claude for realistic test data. Any failure surfaces as an exception so the
 * synthesizer can switch to the rule-based path.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AiValueGenerator implements ValueGenerator {

    private final ClaudeApiService claudeApiService;
    private final ObjectMapper objectMapper;
    private final FieldTypeCatalog catalog;
    private final GenerationConfig config;

    public boolean isAvailable() {
        return claudeApiService.isConfigured();
    }

    @Override
    public List<GeneratedValue> generate(FormMetadata metadata, Scenario scenario, long seed) {
        String prompt = buildPrompt(metadata, scenario, seed);
        String response = claudeApiService.requestTestData(prompt)
                .block(Duration.ofSeconds(config.getAiTimeoutSeconds()));
        if (response == null || response.isBlank()) {
            throw new IllegalStateException("Empty AI response");
        }
        return parseValues(response, metadata, scenario);
    }

    private String buildPrompt(FormMetadata metadata, Scenario scenario, long seed) {
        String fieldsJson;
        try {
            fieldsJson = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(metadata.getFields());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize form fields", e);
        }
        return String.format("""
                You are a QA engineer preparing test data for a web form.

                ## Form
                - URL: %s

                ## Fields
                %s

                ## Scenario: %s
                %s

                Produce exactly one value per field, in the order given. Use seed %d for any
                arbitrary choices so the answer is reproducible.

                Respond ONLY in this JSON format:
                ```json
                {
                  "values": [
                    {"fieldName": "email", "value": "jane.doe@example.com", "expectedOutcome": "ACCEPT", "description": "valid email"},
                    {"fieldName": "terms", "value": true, "expectedOutcome": "ACCEPT", "description": "accepted terms"},
                    {"fieldName": "interests", "value": ["sports", "music"], "expectedOutcome": "ACCEPT", "description": "two options"}
                  ]
                }
                ```
                expectedOutcome is ACCEPT when the form should accept the value and REJECT otherwise.
                """,
                metadata.getPageUrl(), fieldsJson, scenario.name(), scenarioGuidance(scenario), seed);
    }

    private static String scenarioGuidance(Scenario scenario) {
        return switch (scenario) {
            case VALID -> "Every value must satisfy all constraints of its field.";
            case INVALID -> "Each value must break exactly one constraint of its field.";
            case EDGE_CASE -> "Values must be valid but unusual: maximum lengths, unicode, special characters.";
            case BOUNDARY -> "Use the exact inclusive minimum or maximum of each length or value range.";
        };
    }

    @SuppressWarnings("unchecked")
    private List<GeneratedValue> parseValues(String aiResponse, FormMetadata metadata, Scenario scenario) {
        Map<String, Object> parsed;
        try {
            parsed = objectMapper.readValue(extractJson(aiResponse), new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("AI response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        Object rawValues = parsed.get("values");
        if (!(rawValues instanceof List)) {
            throw new IllegalStateException("AI response has no 'values' array");
        }

        List<GeneratedValue> values = new ArrayList<>();
        for (Map<String, Object> entry : (List<Map<String, Object>>) rawValues) {
            String fieldName = (String) entry.get("fieldName");
            FieldSpec field = metadata.getFields().stream()
                    .filter(f -> f.getName().equals(fieldName))
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("AI returned unknown field: " + fieldName));
            SemanticType type = catalog.resolve(field).getSemanticType();

            values.add(GeneratedValue.builder()
                    .fieldName(fieldName)
                    .scenario(scenario)
                    .value(toFieldValue(type, entry.get("value")))
                    .expectedOutcome(ExpectedOutcome.valueOf(
                            String.valueOf(entry.getOrDefault("expectedOutcome", "ACCEPT")).toUpperCase()))
                    .description((String) entry.getOrDefault("description", "AI generated"))
                    .method(GenerationMethod.AI)
                    .build());
        }
        log.info("AI generated {} values for {} fields", values.size(), metadata.getFields().size());
        return values;
    }

    private static FieldValue toFieldValue(SemanticType type, Object raw) {
        if (raw == null) {
            return FieldValue.ofText("");
        }
        switch (type) {
            case CHECKBOX -> {
                return raw instanceof Boolean flag
                        ? FieldValue.ofBoolean(flag)
                        : FieldValue.ofBoolean(FieldValue.ofText(String.valueOf(raw)).asBoolean());
            }
            case MULTI_SELECT -> {
                List<String> options = new ArrayList<>();
                if (raw instanceof Collection<?> collection) {
                    collection.forEach(o -> options.add(String.valueOf(o)));
                } else {
                    options.add(String.valueOf(raw));
                }
                return FieldValue.ofOptions(options);
            }
            case NUMBER -> {
                if (raw instanceof Number) {
                    return FieldValue.ofNumber(new BigDecimal(raw.toString()));
                }
                return FieldValue.ofText(String.valueOf(raw));
            }
            default -> {
                return FieldValue.ofText(String.valueOf(raw));
            }
        }
    }

    private static String extractJson(String text) {
        int start = text.indexOf("```json");
        if (start >= 0) {
            start = text.indexOf('\n', start) + 1;
            int end = text.indexOf("```", start);
            return (end > start ? text.substring(start, end) : text.substring(start)).trim();
        }
        int braceStart = text.indexOf('{');
        int braceEnd = text.lastIndexOf('}');
        if (braceStart >= 0 && braceEnd > braceStart) {
            return text.substring(braceStart, braceEnd + 1);
        }
        return text.trim();
    }
}
