package com.team.formtest.service.catalog;

import com.github.curiousoddman.rgxgen.RgxGen;
import com.team.formtest.model.form.FieldConstraints;
import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.form.SemanticType;
import com.team.formtest.model.generation.FieldValue;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.Scenario;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Rule-based value generation, one entry point per semantic type.
 *
 * Policy per scenario:
 * - VALID: satisfies every constraint, expected ACCEPT
 * - INVALID: breaks exactly one constraint dimension, expected REJECT;
 *   fields without any breakable constraint are reported not-applicable
 * - EDGE_CASE: unusual but valid (max length, unicode, leap day ...), expected ACCEPT
 * - BOUNDARY: inclusive thresholds (ACCEPT) and one unit beyond (REJECT)
 *
 * All randomness comes from the {@link GenerationContext}, so a given seed always
 * yields the same values.
 */
@Slf4j
final class GenerationRules {

    private static final int PATTERN_ATTEMPTS = 60;
    // digit counts beyond this leave the long range used by randomInRange
    private static final int MAX_DIGITS = 18;
    private static final Set<Violation> FORMAT_DIMENSION = EnumSet.of(Violation.FORMAT, Violation.PATTERN);

    private GenerationRules() {
    }

    // ========== Text-like types ==========

    static List<GeneratedValue> text(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        List<String> edge = isNameLike(field)
                ? List.of(SampleData.pick(SampleData.UNICODE_NAMES, ctx.getRandom()))
                : List.of("Ünïcödé téxt — ✓ 42", "O'Brien & Sons <Ltd>");
        return textLike(field, SemanticType.TEXT, scenario, ctx,
                () -> contextualText(field, ctx.getRandom()), edge, List.of());
    }

    static List<GeneratedValue> email(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        return textLike(field, SemanticType.EMAIL, scenario, ctx,
                () -> {
                    Random random = ctx.getRandom();
                    return SampleData.pick(SampleData.FIRST_NAMES, random).toLowerCase(Locale.ROOT) + "."
                            + SampleData.pick(SampleData.LAST_NAMES, random).toLowerCase(Locale.ROOT) + "@"
                            + SampleData.pick(SampleData.DOMAINS, random);
                },
                List.of("user+tag@example.com", "a@b.co", "user.123@domain-with-hyphens.org"),
                SampleData.MALFORMED_EMAILS);
    }

    static List<GeneratedValue> phone(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        return textLike(field, SemanticType.PHONE, scenario, ctx,
                () -> SampleData.pick(SampleData.PHONE_FORMATS, ctx.getRandom()),
                List.of("+1 (555) 123-4567", "+44 20 7946 0958"),
                SampleData.MALFORMED_PHONES);
    }

    static List<GeneratedValue> password(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        FieldConstraints c = field.constraintsOrEmpty();
        int minLength = c.getMinLength() != null ? Math.max(c.getMinLength(), 1) : 8;
        return textLike(field, SemanticType.PASSWORD, scenario, ctx,
                () -> strongPassword(field, ctx.getRandom()),
                List.of(passwordOfLength(minLength, ctx.getRandom())),
                List.of());
    }

    static List<GeneratedValue> url(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        return textLike(field, SemanticType.URL, scenario, ctx,
                () -> "https://www." + SampleData.pick(List.of("example.com", "test.org", "demo.net"), ctx.getRandom()) + "/page",
                List.of("https://example.com/path?q=a%20b#frag", "http://localhost:8080/"),
                List.of("not-a-url", "htp:/broken", "www.missing-scheme.com"));
    }

    static List<GeneratedValue> textarea(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        return textLike(field, SemanticType.TEXTAREA, scenario, ctx,
                () -> SampleData.PARAGRAPH,
                List.of(SampleData.UNICODE_PARAGRAPH),
                List.of());
    }

    static List<GeneratedValue> date(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        return textLike(field, SemanticType.DATE, scenario, ctx,
                () -> randomDate(ctx),
                List.of("2024-02-29", "1970-01-01"),
                List.of("2023-13-45", "31/12/2023", "yesterday"));
    }

    static List<GeneratedValue> time(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        return textLike(field, SemanticType.TIME, scenario, ctx,
                () -> randomTime(ctx.getRandom()),
                List.of("23:59", "00:00"),
                List.of("25:70", "noon"));
    }

    static List<GeneratedValue> datetime(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        return textLike(field, SemanticType.DATETIME, scenario, ctx,
                () -> randomDate(ctx) + "T" + randomTime(ctx.getRandom()),
                List.of("2024-02-29T23:59", "1970-01-01T00:00"),
                List.of("2023-13-45T25:70", "2023-01-01 10:00"));
    }

    static List<GeneratedValue> file(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        if (scenario == Scenario.INVALID && !field.constraintsOrEmpty().hasPattern() && !field.isRequired()) {
            return List.of(GeneratedValue.notApplicable(field.getName(), scenario, "file field without constraints"));
        }
        return textLike(field, SemanticType.FILE, scenario, ctx,
                () -> "sample_file" + SampleData.pick(SampleData.FILE_EXTENSIONS, ctx.getRandom()),
                List.of("résumé final (1).pdf"),
                List.of());
    }

    /**
     * Shared policy for every type whose value is typed as text.
     */
    private static List<GeneratedValue> textLike(FieldSpec field, SemanticType type, Scenario scenario,
                                                 GenerationContext ctx, Supplier<String> validCandidate,
                                                 List<String> edgeCandidates, List<String> malformed) {
        return switch (scenario) {
            case VALID -> List.of(validText(field, type, scenario, ctx, validCandidate));
            case INVALID -> List.of(invalidText(field, type, ctx, validCandidate, malformed));
            case EDGE_CASE -> List.of(edgeText(field, type, ctx, validCandidate, edgeCandidates));
            case BOUNDARY -> lengthBoundary(field, type, ctx, validCandidate);
        };
    }

    private static GeneratedValue validText(FieldSpec field, SemanticType type, Scenario scenario,
                                            GenerationContext ctx, Supplier<String> candidate) {
        String value = fit(field, type, candidate.get(), ctx);
        return GeneratedValue.accept(field.getName(), scenario, FieldValue.ofText(value), "valid " + type.getValue());
    }

    private static GeneratedValue invalidText(FieldSpec field, SemanticType type, GenerationContext ctx,
                                              Supplier<String> validCandidate, List<String> malformed) {
        FieldConstraints c = field.constraintsOrEmpty();
        String name = field.getName();

        // 1. intrinsic format of the type (also breaks a format pattern, same dimension)
        String formatOnly = null;
        String fallback = null;
        if (!malformed.isEmpty()) {
            List<String> shuffled = new ArrayList<>(malformed);
            Collections.shuffle(shuffled, ctx.getRandom());
            for (String candidate : shuffled) {
                Set<Violation> found = ConstraintChecker.violations(field, type, FieldValue.ofText(candidate));
                if (!found.isEmpty() && FORMAT_DIMENSION.containsAll(found)) {
                    // a declared pattern must reject it as well
                    if (!c.hasPattern() || found.contains(Violation.PATTERN)) {
                        return GeneratedValue.reject(name, Scenario.INVALID, FieldValue.ofText(candidate), "malformed " + type.getValue());
                    }
                    if (formatOnly == null) {
                        formatOnly = candidate;
                    }
                } else if (fallback == null && found.contains(Violation.FORMAT)) {
                    fallback = candidate;
                }
            }
        }

        // 2. pattern
        if (c.hasPattern()) {
            Optional<String> mismatch = notMatchingPattern(field, type, ctx);
            if (mismatch.isPresent()) {
                return GeneratedValue.reject(name, Scenario.INVALID, FieldValue.ofText(mismatch.get()),
                        "does not match pattern " + c.getPattern());
            }
        }
        if (formatOnly != null || fallback != null) {
            return GeneratedValue.reject(name, Scenario.INVALID,
                    FieldValue.ofText(formatOnly != null ? formatOnly : fallback), "malformed " + type.getValue());
        }

        String base = fit(field, type, validCandidate.get(), ctx);

        // 3. length
        if (c.getMinLength() != null && c.getMinLength() > 0) {
            String shorter = resize(type, base, c.getMinLength() - 1);
            if (ConstraintChecker.violations(field, type, FieldValue.ofText(shorter)).contains(Violation.MIN_LENGTH)) {
                return GeneratedValue.reject(name, Scenario.INVALID, FieldValue.ofText(shorter),
                        "shorter than min length " + c.getMinLength());
            }
        }
        if (c.getMaxLength() != null) {
            String longer = resize(type, base, c.getMaxLength() + 1);
            if (ConstraintChecker.violations(field, type, FieldValue.ofText(longer)).contains(Violation.MAX_LENGTH)) {
                return GeneratedValue.reject(name, Scenario.INVALID, FieldValue.ofText(longer),
                        "longer than max length " + c.getMaxLength());
            }
        }

        // 4. required
        if (field.isRequired()) {
            return GeneratedValue.reject(name, Scenario.INVALID, FieldValue.ofText(""), "required field left empty");
        }
        return GeneratedValue.notApplicable(name, Scenario.INVALID, "no violable constraint");
    }

    private static GeneratedValue edgeText(FieldSpec field, SemanticType type, GenerationContext ctx,
                                           Supplier<String> validCandidate, List<String> edgeCandidates) {
        FieldConstraints c = field.constraintsOrEmpty();
        List<String> candidates = new ArrayList<>();
        if (c.getMaxLength() != null && !c.hasPattern()) {
            candidates.add(resize(type, fit(field, type, validCandidate.get(), ctx), c.getMaxLength()));
        }
        candidates.addAll(edgeCandidates);
        for (String candidate : candidates) {
            if (ConstraintChecker.satisfies(field, type, FieldValue.ofText(candidate))) {
                String description = c.getMaxLength() != null && candidate.length() == c.getMaxLength()
                        ? "maximum length " + c.getMaxLength()
                        : "edge case " + type.getValue();
                return GeneratedValue.accept(field.getName(), Scenario.EDGE_CASE, FieldValue.ofText(candidate), description);
            }
        }
        return validText(field, type, Scenario.EDGE_CASE, ctx, validCandidate);
    }

    private static List<GeneratedValue> lengthBoundary(FieldSpec field, SemanticType type, GenerationContext ctx,
                                                       Supplier<String> validCandidate) {
        FieldConstraints c = field.constraintsOrEmpty();
        if (!c.hasLengthRange()) {
            return List.of(validText(field, type, Scenario.BOUNDARY, ctx, validCandidate));
        }
        String base = fit(field, type, validCandidate.get(), ctx);
        String name = field.getName();
        List<GeneratedValue> values = new ArrayList<>();

        if (c.getMinLength() != null && c.getMinLength() > 0) {
            int min = c.getMinLength();
            exactLength(field, type, ctx, base, min, true).ifPresent(v ->
                    values.add(GeneratedValue.accept(name, Scenario.BOUNDARY, FieldValue.ofText(v), "min length " + min)));
            exactLength(field, type, ctx, base, min - 1, false).ifPresent(v ->
                    values.add(GeneratedValue.reject(name, Scenario.BOUNDARY, FieldValue.ofText(v), "min length - 1")));
        }
        if (c.getMaxLength() != null) {
            int max = c.getMaxLength();
            exactLength(field, type, ctx, base, max, true).ifPresent(v ->
                    values.add(GeneratedValue.accept(name, Scenario.BOUNDARY, FieldValue.ofText(v), "max length " + max)));
            exactLength(field, type, ctx, base, max + 1, false).ifPresent(v ->
                    values.add(GeneratedValue.reject(name, Scenario.BOUNDARY, FieldValue.ofText(v), "max length + 1")));
        }
        if (values.isEmpty()) {
            return List.of(validText(field, type, Scenario.BOUNDARY, ctx, validCandidate));
        }
        return values;
    }

    private static Optional<String> exactLength(FieldSpec field, SemanticType type, GenerationContext ctx,
                                                String base, int length, boolean accept) {
        if (length < 0) {
            return Optional.empty();
        }
        List<String> candidates = new ArrayList<>();
        candidates.add(resize(type, base, length));
        if (field.constraintsOrEmpty().hasPattern()) {
            patternSamples(field.constraintsOrEmpty().getPattern(), ctx.getRandom()).stream()
                    .filter(s -> s.length() == length)
                    .forEach(candidates::add);
        }
        for (String candidate : candidates) {
            Set<Violation> found = ConstraintChecker.violations(field, type, FieldValue.ofText(candidate));
            if (accept && found.isEmpty()) {
                return Optional.of(candidate);
            }
            if (!accept && !found.isEmpty()
                    && EnumSet.of(Violation.MIN_LENGTH, Violation.MAX_LENGTH, Violation.REQUIRED).containsAll(found)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    // ========== Numbers ==========

    static List<GeneratedValue> number(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        FieldConstraints c = field.constraintsOrEmpty();
        String name = field.getName();
        BigDecimal min = c.getMinValue() != null ? BigDecimal.valueOf(c.getMinValue()) : null;
        BigDecimal max = c.getMaxValue() != null ? BigDecimal.valueOf(c.getMaxValue()) : null;
        boolean integral = isIntegral(min) && isIntegral(max);
        BigDecimal unit = integral ? BigDecimal.ONE : new BigDecimal("0.01");

        return switch (scenario) {
            case VALID -> List.of(GeneratedValue.accept(name, scenario,
                    validNumber(field, min, max, integral, ctx), "number in range"));
            case INVALID -> {
                if (max != null) {
                    yield List.of(GeneratedValue.reject(name, scenario, number(max.add(unit)), "above maximum " + plain(max)));
                }
                if (min != null) {
                    yield List.of(GeneratedValue.reject(name, scenario, number(min.subtract(unit)), "below minimum " + plain(min)));
                }
                yield List.of(GeneratedValue.reject(name, scenario, FieldValue.ofText("not-a-number"), "non-numeric input"));
            }
            case EDGE_CASE -> {
                List<GeneratedValue> edges = new ArrayList<>();
                if (min != null && max != null && max.subtract(min).compareTo(unit.add(unit)) >= 0) {
                    edges.add(GeneratedValue.accept(name, scenario, number(min.add(unit)), "just above minimum"));
                }
                if (min != null || max != null) {
                    BigDecimal edge = min != null ? min : max;
                    edges.add(GeneratedValue.accept(name, scenario, number(edge), "range limit"));
                }
                edges.add(GeneratedValue.accept(name, scenario, FieldValue.ofNumber(0), "zero"));
                for (GeneratedValue edge : edges) {
                    if (ConstraintChecker.satisfies(field, SemanticType.NUMBER, edge.getValue())) {
                        yield List.of(edge);
                    }
                }
                yield List.of(GeneratedValue.accept(name, scenario,
                        validNumber(field, min, max, integral, ctx), "number in range"));
            }
            case BOUNDARY -> {
                List<GeneratedValue> values = new ArrayList<>();
                if (min != null) {
                    addBoundaryPair(field, values, number(min), "minimum " + plain(min),
                            number(min.subtract(unit)), "minimum - " + plain(unit));
                }
                if (max != null) {
                    addBoundaryPair(field, values, number(max), "maximum " + plain(max),
                            number(max.add(unit)), "maximum + " + plain(unit));
                }
                if (values.isEmpty()) {
                    values.add(GeneratedValue.accept(name, scenario,
                            validNumber(field, min, max, integral, ctx), "no usable range, valid number"));
                }
                yield values;
            }
        };
    }

    /**
     * A threshold is only worth testing when the threshold itself passes every other constraint.
     */
    private static void addBoundaryPair(FieldSpec field, List<GeneratedValue> values,
                                        FieldValue inside, String insideDescription,
                                        FieldValue outside, String outsideDescription) {
        if (!ConstraintChecker.satisfies(field, SemanticType.NUMBER, inside)
                || ConstraintChecker.satisfies(field, SemanticType.NUMBER, outside)) {
            return;
        }
        values.add(GeneratedValue.accept(field.getName(), Scenario.BOUNDARY, inside, insideDescription));
        values.add(GeneratedValue.reject(field.getName(), Scenario.BOUNDARY, outside, outsideDescription));
    }

    /**
     * A number inside the value range that also honours length and pattern. Draws from the
     * range first, then from the range narrowed to the allowed digit count, then from the pattern.
     */
    private static FieldValue validNumber(FieldSpec field, BigDecimal min, BigDecimal max, boolean integral,
                                          GenerationContext ctx) {
        FieldConstraints c = field.constraintsOrEmpty();
        FieldValue first = FieldValue.ofNumber(randomInRange(min, max, integral, ctx.getRandom()));
        if (ConstraintChecker.satisfies(field, SemanticType.NUMBER, first)) {
            return first;
        }

        BigDecimal low = min;
        BigDecimal high = max;
        if (c.getMinLength() != null && c.getMinLength() > 1 && c.getMinLength() <= MAX_DIGITS) {
            low = greater(low, BigDecimal.TEN.pow(c.getMinLength() - 1));
        }
        if (c.getMaxLength() != null && c.getMaxLength() > 0 && c.getMaxLength() <= MAX_DIGITS) {
            high = lesser(high, BigDecimal.TEN.pow(c.getMaxLength()).subtract(BigDecimal.ONE));
            low = low != null ? low : BigDecimal.ZERO;
        }
        if (low == null || high == null || low.compareTo(high) <= 0) {
            for (int i = 0; i < PATTERN_ATTEMPTS; i++) {
                FieldValue candidate = FieldValue.ofNumber(randomInRange(low, high, true, ctx.getRandom()));
                if (ConstraintChecker.satisfies(field, SemanticType.NUMBER, candidate)) {
                    return candidate;
                }
            }
        }

        // kept as text so leading zeros survive
        for (String sample : patternSamples(c.getPattern(), ctx.getRandom())) {
            FieldValue candidate = FieldValue.ofText(sample);
            if (ConstraintChecker.satisfies(field, SemanticType.NUMBER, candidate)) {
                return candidate;
            }
        }
        log.debug("No number satisfies every constraint of field '{}', using {}", field.getName(), first.asText());
        return first;
    }

    // ========== Choices ==========

    static List<GeneratedValue> checkbox(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        String name = field.getName();
        return switch (scenario) {
            case INVALID -> field.isRequired()
                    ? List.of(GeneratedValue.reject(name, scenario, FieldValue.ofBoolean(false), "required checkbox left unchecked"))
                    : List.of(GeneratedValue.notApplicable(name, scenario, "optional checkbox has no invalid state"));
            case VALID -> List.of(GeneratedValue.accept(name, scenario,
                    FieldValue.ofBoolean(field.isRequired() || ctx.getRandom().nextBoolean()), "valid checkbox state"));
            case EDGE_CASE, BOUNDARY -> List.of(GeneratedValue.accept(name, scenario, FieldValue.ofBoolean(true), "checked"));
        };
    }

    static List<GeneratedValue> singleChoice(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        List<String> options = field.constraintsOrEmpty().getOptions();
        String name = field.getName();
        boolean hasOptions = options != null && !options.isEmpty();
        return switch (scenario) {
            case INVALID -> {
                if (hasOptions) {
                    yield List.of(GeneratedValue.reject(name, scenario, FieldValue.ofText(outsideOptions(options)), "option not offered"));
                }
                if (field.isRequired()) {
                    yield List.of(GeneratedValue.reject(name, scenario, FieldValue.ofText(""), "required choice left empty"));
                }
                yield List.of(GeneratedValue.notApplicable(name, scenario, "no options to violate"));
            }
            case EDGE_CASE -> List.of(GeneratedValue.accept(name, scenario,
                    FieldValue.ofText(hasOptions ? options.get(options.size() - 1) : fallbackChoice(field)), "last option"));
            case VALID, BOUNDARY -> List.of(GeneratedValue.accept(name, scenario,
                    FieldValue.ofText(hasOptions ? SampleData.pick(options, ctx.getRandom()) : fallbackChoice(field)), "offered option"));
        };
    }

    static List<GeneratedValue> multiChoice(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        List<String> options = field.constraintsOrEmpty().getOptions();
        String name = field.getName();
        boolean hasOptions = options != null && !options.isEmpty();
        return switch (scenario) {
            case INVALID -> {
                if (hasOptions) {
                    yield List.of(GeneratedValue.reject(name, scenario, FieldValue.ofOptions(List.of(outsideOptions(options))), "option not offered"));
                }
                if (field.isRequired()) {
                    yield List.of(GeneratedValue.reject(name, scenario, FieldValue.ofOptions(List.of()), "required selection left empty"));
                }
                yield List.of(GeneratedValue.notApplicable(name, scenario, "no options to violate"));
            }
            case EDGE_CASE -> List.of(GeneratedValue.accept(name, scenario,
                    FieldValue.ofOptions(hasOptions ? options : List.of(fallbackChoice(field))), "every option"));
            case VALID, BOUNDARY -> List.of(GeneratedValue.accept(name, scenario,
                    FieldValue.ofOptions(hasOptions ? randomSubset(options, ctx.getRandom()) : List.of(fallbackChoice(field))),
                    "offered options"));
        };
    }

    static List<GeneratedValue> hidden(FieldSpec field, Scenario scenario, GenerationContext ctx) {
        if (scenario == Scenario.INVALID) {
            return List.of(GeneratedValue.notApplicable(field.getName(), scenario, "hidden field is not user editable"));
        }
        String value = field.getDefaultValue() != null && !field.getDefaultValue().isEmpty()
                ? field.getDefaultValue() : "hidden-value";
        return List.of(GeneratedValue.accept(field.getName(), scenario,
                FieldValue.ofText(fit(field, SemanticType.HIDDEN, value, ctx)), "hidden value"));
    }

    // ========== Helpers ==========

    /**
     * Bring a candidate within the field's constraints: keep it when it already fits,
     * otherwise resize it or draw from the pattern.
     */
    static String fit(FieldSpec field, SemanticType type, String candidate, GenerationContext ctx) {
        FieldConstraints c = field.constraintsOrEmpty();
        if (ConstraintChecker.satisfies(field, type, FieldValue.ofText(candidate))) {
            return candidate;
        }
        if (!c.hasPattern()) {
            int target = candidate.length();
            if (c.getMinLength() != null) {
                target = Math.max(target, c.getMinLength());
            }
            if (c.getMaxLength() != null) {
                target = Math.min(target, c.getMaxLength());
            }
            String resized = resize(type, candidate, Math.max(target, field.isRequired() ? 1 : 0));
            if (ConstraintChecker.satisfies(field, type, FieldValue.ofText(resized))) {
                return resized;
            }
        }
        for (String sample : patternSamples(c.getPattern(), ctx.getRandom())) {
            if (ConstraintChecker.satisfies(field, type, FieldValue.ofText(sample))) {
                return sample;
            }
        }
        return candidate;
    }

    /**
     * A value of exactly {@code length} characters shaped like the type.
     */
    static String resize(SemanticType type, String base, int length) {
        if (length <= 0) {
            return "";
        }
        switch (type) {
            case EMAIL -> {
                String domain = "@example.com";
                if (length > domain.length()) {
                    return "x".repeat(length - domain.length()) + domain;
                }
                if (length >= 6) {
                    return "x".repeat(length - 5) + "@b.co";
                }
                return "x".repeat(length);
            }
            case PHONE, NUMBER -> {
                return "5".repeat(length);
            }
            case URL -> {
                String prefix = "https://a.co/";
                if (length >= prefix.length()) {
                    return prefix + "a".repeat(length - prefix.length());
                }
                return "x".repeat(length);
            }
            default -> {
                if (base.length() >= length) {
                    return base.substring(0, length);
                }
                return base + "x".repeat(length - base.length());
            }
        }
    }

    private static List<String> patternSamples(String pattern, Random random) {
        if (pattern == null || pattern.isBlank()) {
            return List.of();
        }
        List<String> samples = new ArrayList<>();
        try {
            RgxGen generator = new RgxGen(pattern);
            for (int i = 0; i < PATTERN_ATTEMPTS; i++) {
                samples.add(generator.generate(random));
            }
        } catch (RuntimeException e) {
            log.debug("Cannot generate from pattern '{}': {}", pattern, e.getMessage());
        }
        return samples;
    }

    private static Optional<String> notMatchingPattern(FieldSpec field, SemanticType type, GenerationContext ctx) {
        String pattern = field.constraintsOrEmpty().getPattern();
        List<String> candidates = new ArrayList<>();
        try {
            RgxGen generator = new RgxGen(pattern);
            for (int i = 0; i < PATTERN_ATTEMPTS; i++) {
                candidates.add(generator.generateNotMatching(ctx.getRandom()));
            }
        } catch (RuntimeException e) {
            log.debug("Cannot generate a mismatch for pattern '{}': {}", pattern, e.getMessage());
        }
        candidates.add("!!" + fit(field, type, "invalid", ctx) + "!!");
        candidates.add("#");
        for (String candidate : candidates) {
            if (candidate.isEmpty()) {
                continue;
            }
            Set<Violation> found = ConstraintChecker.violations(field, type, FieldValue.ofText(candidate));
            if (!found.isEmpty() && FORMAT_DIMENSION.containsAll(found)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static String contextualText(FieldSpec field, Random random) {
        String context = fieldContext(field);
        if (context.contains("last") || context.contains("family") || context.contains("surname")) {
            return SampleData.pick(SampleData.LAST_NAMES, random);
        }
        if (context.contains("first") || context.contains("given")) {
            return SampleData.pick(SampleData.FIRST_NAMES, random);
        }
        if (context.contains("name")) {
            return SampleData.pick(SampleData.FIRST_NAMES, random) + " " + SampleData.pick(SampleData.LAST_NAMES, random);
        }
        if (context.contains("city") || context.contains("town")) {
            return SampleData.pick(SampleData.CITIES, random);
        }
        if (context.contains("state") || context.contains("province")) {
            return SampleData.pick(SampleData.STATES, random);
        }
        if (context.contains("address") || context.contains("street")) {
            return (100 + random.nextInt(9900)) + " " + SampleData.pick(SampleData.STREETS, random) + " St";
        }
        if (context.contains("zip") || context.contains("postal")) {
            return String.valueOf(10000 + random.nextInt(90000));
        }
        if (context.contains("company") || context.contains("organization")) {
            return SampleData.pick(SampleData.COMPANIES, random);
        }
        return "Sample text " + (1 + random.nextInt(1000));
    }

    private static boolean isNameLike(FieldSpec field) {
        return fieldContext(field).contains("name");
    }

    private static String fieldContext(FieldSpec field) {
        String label = field.getLabel() != null ? field.getLabel() : "";
        String name = field.getName() != null ? field.getName() : "";
        return (label + " " + name).toLowerCase(Locale.ROOT);
    }

    private static String strongPassword(FieldSpec field, Random random) {
        FieldConstraints c = field.constraintsOrEmpty();
        int low = c.getMinLength() != null ? Math.max(c.getMinLength(), 1) : 8;
        int high = c.getMaxLength() != null ? c.getMaxLength() : Math.max(low, 20);
        if (high < low) {
            high = low;
        }
        return passwordOfLength(low + random.nextInt(high - low + 1), random);
    }

    private static String passwordOfLength(int length, Random random) {
        String pool = "ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz23456789!@#$%^&*";
        List<Character> chars = new ArrayList<>();
        for (char required : new char[]{'A', 'a', '1', '!'}) {
            if (chars.size() < length) {
                chars.add(required);
            }
        }
        while (chars.size() < length) {
            chars.add(pool.charAt(random.nextInt(pool.length())));
        }
        Collections.shuffle(chars, random);
        StringBuilder sb = new StringBuilder(length);
        chars.forEach(sb::append);
        return sb.toString();
    }

    private static String randomDate(GenerationContext ctx) {
        return ctx.getToday().plusDays(ctx.getRandom().nextInt(731) - 365L).toString();
    }

    private static String randomTime(Random random) {
        return String.format("%02d:%02d", random.nextInt(24), random.nextInt(60));
    }

    private static BigDecimal randomInRange(BigDecimal min, BigDecimal max, boolean integral, Random random) {
        BigDecimal low = min != null ? min : (max != null ? max.subtract(BigDecimal.valueOf(1000)) : BigDecimal.ZERO);
        BigDecimal high = max != null ? max : low.add(BigDecimal.valueOf(1000));
        if (integral) {
            long lo = low.setScale(0, RoundingMode.CEILING).longValueExact();
            long hi = high.setScale(0, RoundingMode.FLOOR).longValueExact();
            if (hi <= lo) {
                return BigDecimal.valueOf(lo);
            }
            long span = hi - lo + 1;
            return BigDecimal.valueOf(lo + (long) Math.floor(random.nextDouble() * span));
        }
        BigDecimal value = low.add(high.subtract(low).multiply(BigDecimal.valueOf(random.nextDouble())))
                .setScale(2, RoundingMode.HALF_UP);
        if (value.compareTo(low) < 0) {
            return low;
        }
        return value.compareTo(high) > 0 ? high : value;
    }

    private static BigDecimal lesser(BigDecimal a, BigDecimal b) {
        return a == null ? b : a.min(b);
    }

    private static BigDecimal greater(BigDecimal a, BigDecimal b) {
        return a == null ? b : a.max(b);
    }

    private static boolean isIntegral(BigDecimal value) {
        return value == null || value.stripTrailingZeros().scale() <= 0;
    }

    private static FieldValue number(BigDecimal value) {
        return FieldValue.ofNumber(value.stripTrailingZeros().scale() <= 0 ? value.setScale(0, RoundingMode.UNNECESSARY) : value);
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    private static String outsideOptions(List<String> options) {
        String candidate = "invalid_option";
        int suffix = 1;
        while (options.contains(candidate)) {
            candidate = "invalid_option_" + suffix++;
        }
        return candidate;
    }

    private static String fallbackChoice(FieldSpec field) {
        return field.getDefaultValue() != null && !field.getDefaultValue().isEmpty() ? field.getDefaultValue() : "option1";
    }

    private static List<String> randomSubset(List<String> options, Random random) {
        int size = 1 + random.nextInt(Math.min(2, options.size()));
        List<String> shuffled = new ArrayList<>(options);
        Collections.shuffle(shuffled, random);
        List<String> chosen = shuffled.subList(0, size);
        // keep document order
        List<String> ordered = new ArrayList<>();
        for (String option : options) {
            if (chosen.contains(option)) {
                ordered.add(option);
            }
        }
        return ordered;
    }
}
