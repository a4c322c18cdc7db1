package com.team.formtest.service.catalog;

import com.team.formtest.exception.UnsupportedFieldTypeException;
import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.form.SemanticType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Static table from semantic field type to its generation rule and interaction rule.
 * Every {@link SemanticType} has exactly one entry.
 */
@Slf4j
@Component
public class FieldTypeCatalog {

    private final Map<SemanticType, FieldRules> rules;

    public FieldTypeCatalog() {
        Map<SemanticType, FieldRules> table = new EnumMap<>(SemanticType.class);
        for (SemanticType type : SemanticType.values()) {
            table.put(type, entryFor(type));
        }
        this.rules = Collections.unmodifiableMap(table);
    }

    public FieldRules rulesFor(SemanticType type) {
        return rules.get(type);
    }

    /**
     * @throws UnsupportedFieldTypeException for a type name the catalog does not know
     */
    public FieldRules rulesFor(String typeName) {
        return rulesFor(SemanticType.fromName(typeName));
    }

    /**
     * Rules for a field, treating an unknown declared type as plain text so that
     * one odd field does not abort a whole run.
     */
    public FieldRules resolve(FieldSpec field) {
        try {
            return rulesFor(field.getType());
        } catch (UnsupportedFieldTypeException e) {
            log.warn("Field '{}' has unsupported type '{}', handling it as text", field.getName(), field.getType());
            return rules.get(SemanticType.TEXT);
        }
    }

    private static FieldRules entryFor(SemanticType type) {
        return switch (type) {
            case TEXT -> new FieldRules(type, GenerationRules::text, InteractionRule.TYPE_TEXT);
            case EMAIL -> new FieldRules(type, GenerationRules::email, InteractionRule.TYPE_TEXT);
            case PHONE -> new FieldRules(type, GenerationRules::phone, InteractionRule.TYPE_TEXT);
            case PASSWORD -> new FieldRules(type, GenerationRules::password, InteractionRule.TYPE_TEXT);
            case NUMBER -> new FieldRules(type, GenerationRules::number, InteractionRule.TYPE_TEXT);
            case DATE -> new FieldRules(type, GenerationRules::date, InteractionRule.TYPE_TEXT);
            case TIME -> new FieldRules(type, GenerationRules::time, InteractionRule.TYPE_TEXT);
            case DATETIME -> new FieldRules(type, GenerationRules::datetime, InteractionRule.TYPE_TEXT);
            case URL -> new FieldRules(type, GenerationRules::url, InteractionRule.TYPE_TEXT);
            case TEXTAREA -> new FieldRules(type, GenerationRules::textarea, InteractionRule.TYPE_TEXT);
            case CHECKBOX -> new FieldRules(type, GenerationRules::checkbox, InteractionRule.TOGGLE);
            case RADIO -> new FieldRules(type, GenerationRules::singleChoice, InteractionRule.CHOOSE_RADIO);
            case SELECT -> new FieldRules(type, GenerationRules::singleChoice, InteractionRule.SELECT_ONE);
            case MULTI_SELECT -> new FieldRules(type, GenerationRules::multiChoice, InteractionRule.SELECT_MANY);
            case FILE -> new FieldRules(type, GenerationRules::file, InteractionRule.UPLOAD);
            case HIDDEN -> new FieldRules(type, GenerationRules::hidden, InteractionRule.SET_HIDDEN);
        };
    }
}
