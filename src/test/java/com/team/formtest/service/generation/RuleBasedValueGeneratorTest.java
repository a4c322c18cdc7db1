package com.team.formtest.service.generation;

import com.team.formtest.TestForms;
import com.team.formtest.model.form.FieldConstraints;
import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.form.FormMetadata;
import com.team.formtest.model.form.SemanticType;
import com.team.formtest.model.generation.ExpectedOutcome;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.Scenario;
import com.team.formtest.service.catalog.ConstraintChecker;
import com.team.formtest.service.catalog.FieldTypeCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedValueGeneratorTest {

    private final FieldTypeCatalog catalog = new FieldTypeCatalog();
    private RuleBasedValueGenerator generator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC);
        generator = new RuleBasedValueGenerator(catalog, clock);
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 2024L, -7L, 123456789L})
    void validValuesSatisfyTheirFieldConstraints(long seed) {
        FormMetadata form = TestForms.everyType();

        List<GeneratedValue> values = generator.generate(form, Scenario.VALID, seed);

        assertThat(values).hasSize(form.getFields().size());
        for (int i = 0; i < values.size(); i++) {
            FieldSpec field = form.getFields().get(i);
            GeneratedValue value = values.get(i);
            SemanticType type = catalog.resolve(field).getSemanticType();

            assertThat(value.getFieldName()).isEqualTo(field.getName());
            assertThat(value.getExpectedOutcome()).isEqualTo(ExpectedOutcome.ACCEPT);
            assertThat(ConstraintChecker.violations(field, type, value.getValue()))
                    .as("field %s value '%s'", field.getName(), value.getValue().asText())
                    .isEmpty();
        }
    }

    @ParameterizedTest
    @EnumSource(Scenario.class)
    void sameSeedGivesIdenticalValues(Scenario scenario) {
        FormMetadata form = TestForms.everyType();

        List<GeneratedValue> first = generator.generate(form, scenario, 99L);
        List<GeneratedValue> second = generator.generate(form, scenario, 99L);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void differentSeedsVaryTheData() {
        FormMetadata form = TestForms.everyType();

        List<String> a = texts(generator.generate(form, Scenario.VALID, 1L));
        List<String> b = texts(generator.generate(form, Scenario.VALID, 2L));

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void invalidEmailIsMalformedAndExpectedToBeRejected() {
        FormMetadata form = TestForms.signup();

        List<GeneratedValue> values = generator.generate(form, Scenario.INVALID, 5L);

        GeneratedValue email = values.get(0);
        assertThat(email.getFieldName()).isEqualTo("email");
        assertThat(email.getExpectedOutcome()).isEqualTo(ExpectedOutcome.REJECT);
        assertThat(ConstraintChecker.satisfies(form.getFields().get(0), SemanticType.EMAIL, email.getValue())).isFalse();
        assertThat(ConstraintChecker.matchesPattern(TestForms.EMAIL_PATTERN, email.getValue().asText())).isFalse();
    }

    @Test
    void invalidAgeLeavesTheRange() {
        FormMetadata form = TestForms.signup();

        GeneratedValue age = generator.generate(form, Scenario.INVALID, 5L).get(1);

        assertThat(age.getExpectedOutcome()).isEqualTo(ExpectedOutcome.REJECT);
        assertThat(age.getValue().asText()).isEqualTo("66");
    }

    @Test
    void boundaryAgeIncludesBothThresholdsAndOneBeyondEach() {
        FormMetadata form = TestForms.signup();

        List<GeneratedValue> age = generator.generate(form, Scenario.BOUNDARY, 5L).stream()
                .filter(v -> v.getFieldName().equals("age"))
                .toList();

        assertThat(age).extracting(v -> v.getValue().asText(), GeneratedValue::getExpectedOutcome)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple("18", ExpectedOutcome.ACCEPT),
                        org.assertj.core.groups.Tuple.tuple("17", ExpectedOutcome.REJECT),
                        org.assertj.core.groups.Tuple.tuple("65", ExpectedOutcome.ACCEPT),
                        org.assertj.core.groups.Tuple.tuple("66", ExpectedOutcome.REJECT));
    }

    @Test
    void boundaryLengthUsesExactThresholds() {
        FieldSpec name = TestForms.field("nickname", "text", true,
                FieldConstraints.builder().minLength(3).maxLength(8).build());
        FormMetadata form = TestForms.form("nick", name);

        List<GeneratedValue> values = generator.generate(form, Scenario.BOUNDARY, 11L);

        assertThat(values).extracting(v -> v.getValue().asText().length(), GeneratedValue::getExpectedOutcome)
                .containsExactly(
                        org.assertj.core.groups.Tuple.tuple(3, ExpectedOutcome.ACCEPT),
                        org.assertj.core.groups.Tuple.tuple(2, ExpectedOutcome.REJECT),
                        org.assertj.core.groups.Tuple.tuple(8, ExpectedOutcome.ACCEPT),
                        org.assertj.core.groups.Tuple.tuple(9, ExpectedOutcome.REJECT));
    }

    @Test
    void boundaryDecimalRangeStepsByOneCent() {
        FieldSpec price = TestForms.field("price", "number", false,
                FieldConstraints.builder().minValue(0.5).maxValue(99.99).build());

        List<GeneratedValue> values = generator.generate(TestForms.form("p", price), Scenario.BOUNDARY, 3L);

        assertThat(values).extracting(v -> v.getValue().asText())
                .containsExactly("0.5", "0.49", "99.99", "100");
    }

    @Test
    void numbersAndHiddenValuesHonourPatternAndLength() {
        FieldSpec zip = TestForms.field("zip", "number", true, FieldConstraints.builder().pattern("\\d{5}").build());
        FieldSpec quantity = TestForms.field("quantity", "number", true, FieldConstraints.builder().maxLength(2).build());
        FieldSpec nonce = TestForms.field("nonce", "hidden", false, FieldConstraints.builder().pattern("[0-9a-f]{8}").build());
        FormMetadata form = TestForms.form("mixed", zip, quantity, nonce);

        for (long seed = 0; seed < 20; seed++) {
            for (Scenario scenario : List.of(Scenario.VALID, Scenario.EDGE_CASE, Scenario.BOUNDARY)) {
                for (GeneratedValue value : generator.generate(form, scenario, seed)) {
                    if (value.expectsReject()) {
                        continue;
                    }
                    FieldSpec field = form.getFields().stream()
                            .filter(f -> f.getName().equals(value.getFieldName()))
                            .findFirst()
                            .orElseThrow();
                    SemanticType type = catalog.resolve(field).getSemanticType();
                    assertThat(ConstraintChecker.violations(field, type, value.getValue()))
                            .as("seed %d %s field %s value '%s'", seed, scenario, field.getName(), value.getValue().asText())
                            .isEmpty();
                }
            }
        }
    }

    @Test
    void boundaryThresholdsThatBreakThePatternAreLeftOut() {
        FieldSpec code = TestForms.field("code", "number", true,
                FieldConstraints.builder().minValue(0.0).maxValue(999.0).pattern("\\d{2}").build());

        List<GeneratedValue> values = generator.generate(TestForms.form("c", code), Scenario.BOUNDARY, 6L);

        assertThat(values).hasSize(1);
        assertThat(values.get(0).getExpectedOutcome()).isEqualTo(ExpectedOutcome.ACCEPT);
        assertThat(values.get(0).getValue().asText()).matches("\\d{2}");
    }

    @Test
    void freeTextWithoutConstraintsIsNotApplicableForInvalid() {
        FieldSpec notes = TestForms.field("notes", "text", false);

        List<GeneratedValue> values = generator.generate(TestForms.form("n", notes), Scenario.INVALID, 1L);

        assertThat(values).hasSize(1);
        assertThat(values.get(0).isApplicable()).isFalse();
        assertThat(values.get(0).getValue()).isNull();
        assertThat(values.get(0).expectsReject()).isFalse();
    }

    @Test
    void requiredFreeTextIsLeftEmptyForInvalid() {
        FieldSpec notes = TestForms.field("notes", "text", true);

        GeneratedValue value = generator.generate(TestForms.form("n", notes), Scenario.INVALID, 1L).get(0);

        assertThat(value.getExpectedOutcome()).isEqualTo(ExpectedOutcome.REJECT);
        assertThat(value.getValue().asText()).isEmpty();
    }

    @Test
    void invalidValuesBreakTheirFieldConstraints() {
        FormMetadata form = TestForms.everyType();

        List<GeneratedValue> values = generator.generate(form, Scenario.INVALID, 17L);

        for (int i = 0; i < values.size(); i++) {
            GeneratedValue value = values.get(i);
            if (!value.isApplicable()) {
                continue;
            }
            FieldSpec field = form.getFields().get(i);
            SemanticType type = catalog.resolve(field).getSemanticType();
            assertThat(value.getExpectedOutcome()).isEqualTo(ExpectedOutcome.REJECT);
            assertThat(ConstraintChecker.satisfies(field, type, value.getValue()))
                    .as("field %s value '%s'", field.getName(), value.getValue().asText())
                    .isFalse();
        }
    }

    @Test
    void edgeCaseValuesStayValid() {
        FormMetadata form = TestForms.everyType();

        List<GeneratedValue> values = generator.generate(form, Scenario.EDGE_CASE, 8L);

        for (int i = 0; i < values.size(); i++) {
            FieldSpec field = form.getFields().get(i);
            SemanticType type = catalog.resolve(field).getSemanticType();
            assertThat(values.get(i).getExpectedOutcome()).isEqualTo(ExpectedOutcome.ACCEPT);
            assertThat(ConstraintChecker.satisfies(field, type, values.get(i).getValue()))
                    .as("field %s", field.getName())
                    .isTrue();
        }
    }

    @Test
    void edgeCaseTextFillsTheMaximumLength() {
        FieldSpec bio = TestForms.field("bio", "textarea", false, FieldConstraints.builder().maxLength(30).build());

        GeneratedValue value = generator.generate(TestForms.form("b", bio), Scenario.EDGE_CASE, 4L).get(0);

        assertThat(value.getValue().asText()).hasSize(30);
        assertThat(value.getDescription()).isEqualTo("maximum length 30");
    }

    @Test
    void unknownTypeFallsBackToText() {
        FieldSpec odd = TestForms.field("color", "color-picker", true);

        List<GeneratedValue> values = generator.generate(TestForms.form("c", odd), Scenario.VALID, 1L);

        assertThat(values).hasSize(1);
        assertThat(values.get(0).getValue().asText()).isNotEmpty();
    }

    @Test
    void contextAwareTextUsesFieldLabel() {
        FieldSpec city = FieldSpec.builder().name("f1").label("City").type("text").locator("#f1").build();

        GeneratedValue value = generator.generate(TestForms.form("c", city), Scenario.VALID, 1L).get(0);

        assertThat(value.getValue().asText()).isIn("New York", "Los Angeles", "Chicago", "Houston", "Phoenix",
                "Philadelphia", "San Antonio", "San Diego", "Dallas", "Austin");
    }

    private static List<String> texts(List<GeneratedValue> values) {
        return values.stream().map(v -> v.getValue().asText()).collect(Collectors.toList());
    }
}
