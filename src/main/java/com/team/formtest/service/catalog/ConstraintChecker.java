package com.team.formtest.service.catalog;

import com.team.formtest.model.form.FieldConstraints;
import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.form.SemanticType;
import com.team.formtest.model.generation.FieldValue;

import java.math.BigDecimal;
import java.net.URI;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks a value against a field's constraints and the intrinsic format of its type.
 */
public final class ConstraintChecker {

    private static final Pattern EMAIL =
            Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9-]+(\\.[A-Za-z0-9-]+)*\\.[A-Za-z]{2,}$");
    private static final Pattern PHONE = Pattern.compile("^\\+?[0-9 ().-]{7,20}$");

    private ConstraintChecker() {
    }

    public static boolean satisfies(FieldSpec field, SemanticType type, FieldValue value) {
        return violations(field, type, value).isEmpty();
    }

    public static Set<Violation> violations(FieldSpec field, SemanticType type, FieldValue value) {
        FieldConstraints c = field.constraintsOrEmpty();
        Set<Violation> found = EnumSet.noneOf(Violation.class);

        switch (type) {
            case CHECKBOX -> {
                if (field.isRequired() && !value.asBoolean()) {
                    found.add(Violation.REQUIRED);
                }
                return found;
            }
            case MULTI_SELECT -> {
                List<String> chosen = value.asOptions();
                if (field.isRequired() && chosen.isEmpty()) {
                    found.add(Violation.REQUIRED);
                }
                if (c.hasOptions() && !c.getOptions().containsAll(chosen)) {
                    found.add(Violation.OPTION);
                }
                return found;
            }
            case RADIO, SELECT -> {
                String chosen = value.asText();
                if (chosen.isEmpty()) {
                    if (field.isRequired()) {
                        found.add(Violation.REQUIRED);
                    }
                } else if (c.hasOptions() && !c.getOptions().contains(chosen)) {
                    found.add(Violation.OPTION);
                }
                return found;
            }
            default -> {
                // text-like, checked below
            }
        }

        String text = value.asText();
        if (text.isEmpty()) {
            if (field.isRequired()) {
                found.add(Violation.REQUIRED);
            }
            if (c.getMinLength() != null && c.getMinLength() > 0) {
                found.add(Violation.MIN_LENGTH);
            }
            return found;
        }

        if (!hasValidFormat(type, text)) {
            found.add(Violation.FORMAT);
        }
        if (c.hasPattern() && !matchesPattern(c.getPattern(), text)) {
            found.add(Violation.PATTERN);
        }
        if (c.getMinLength() != null && text.length() < c.getMinLength()) {
            found.add(Violation.MIN_LENGTH);
        }
        if (c.getMaxLength() != null && text.length() > c.getMaxLength()) {
            found.add(Violation.MAX_LENGTH);
        }
        if (type == SemanticType.NUMBER && c.hasValueRange() && !found.contains(Violation.FORMAT)) {
            BigDecimal number = new BigDecimal(text.trim());
            if (c.getMinValue() != null && number.compareTo(BigDecimal.valueOf(c.getMinValue())) < 0) {
                found.add(Violation.RANGE);
            }
            if (c.getMaxValue() != null && number.compareTo(BigDecimal.valueOf(c.getMaxValue())) > 0) {
                found.add(Violation.RANGE);
            }
        }
        return found;
    }

    public static boolean matchesPattern(String pattern, String text) {
        try {
            return Pattern.compile(pattern).matcher(text).matches();
        } catch (PatternSyntaxException e) {
            // unusable pattern from extraction, treat as unconstrained
            return true;
        }
    }

    static boolean hasValidFormat(SemanticType type, String text) {
        return switch (type) {
            case EMAIL -> EMAIL.matcher(text).matches();
            case PHONE -> PHONE.matcher(text).matches() && digitCount(text) >= 7 && digitCount(text) <= 15;
            case NUMBER -> isNumber(text);
            case URL -> isHttpUrl(text);
            case DATE -> parses(() -> LocalDate.parse(text));
            case TIME -> parses(() -> LocalTime.parse(text));
            case DATETIME -> parses(() -> LocalDateTime.parse(text));
            default -> true;
        };
    }

    private static boolean isNumber(String text) {
        try {
            new BigDecimal(text.trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static boolean isHttpUrl(String text) {
        try {
            URI uri = new URI(text);
            return ("http".equals(uri.getScheme()) || "https".equals(uri.getScheme()))
                    && uri.getHost() != null;
        } catch (Exception e) {
            return false;
        }
    }

    private static boolean parses(Runnable parser) {
        try {
            parser.run();
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static int digitCount(String text) {
        return (int) text.chars().filter(Character::isDigit).count();
    }
}
