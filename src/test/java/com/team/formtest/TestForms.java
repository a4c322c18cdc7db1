package com.team.formtest;

import com.team.formtest.model.form.FieldConstraints;
import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.form.FormMetadata;

import java.util.ArrayList;
import java.util.List;

/**
 * Form fixtures shared by tests.
 */
public final class TestForms {

    public static final String EMAIL_PATTERN = "^[a-z0-9._%+-]+@[a-z0-9.-]+\\.[a-z]{2,}$";

    private TestForms() {
    }

    public static FieldSpec field(String name, String type, boolean required, FieldConstraints constraints) {
        return FieldSpec.builder()
                .name(name)
                .label(name)
                .type(type)
                .required(required)
                .locator("#" + name)
                .constraints(constraints)
                .build();
    }

    public static FieldSpec field(String name, String type, boolean required) {
        return field(name, type, required, FieldConstraints.none());
    }

    public static FieldSpec email() {
        return field("email", "email", true, FieldConstraints.builder().pattern(EMAIL_PATTERN).build());
    }

    public static FieldSpec age() {
        return field("age", "number", true, FieldConstraints.builder().minValue(18.0).maxValue(65.0).build());
    }

    public static FormMetadata form(String id, FieldSpec... fields) {
        return FormMetadata.builder()
                .id(id)
                .pageUrl("http://localhost:3000/signup")
                .submitLocator("#submit")
                .fields(new ArrayList<>(List.of(fields)))
                .build();
    }

    /**
     * Email with a pattern and an age between 18 and 65.
     */
    public static FormMetadata signup() {
        return form("signup", email(), age());
    }

    /**
     * One field of every semantic type, each with typical constraints.
     */
    public static FormMetadata everyType() {
        return form("every-type",
                field("firstName", "text", true, FieldConstraints.builder().minLength(2).maxLength(10).build()),
                field("code", "text", false, FieldConstraints.builder().pattern("[A-Z]{3}-[0-9]{4}").build()),
                email(),
                field("contactEmail", "email", false, FieldConstraints.builder().maxLength(15).build()),
                field("phone", "phone", true),
                field("password", "password", true, FieldConstraints.builder().minLength(8).maxLength(20).build()),
                age(),
                field("price", "number", false, FieldConstraints.builder().minValue(0.5).maxValue(99.99).build()),
                field("zip", "number", true, FieldConstraints.builder().pattern("\\d{5}").build()),
                field("quantity", "number", false, FieldConstraints.builder().maxLength(2).build()),
                field("birthday", "date", false),
                field("alarm", "time", false),
                field("meeting", "datetime", false),
                field("website", "url", false),
                field("bio", "textarea", false, FieldConstraints.builder().maxLength(30).build()),
                field("terms", "checkbox", true),
                field("gender", "radio", true, FieldConstraints.builder().options(List.of("male", "female", "other")).build()),
                field("country", "select", true, FieldConstraints.builder().options(List.of("us", "ca", "mx")).build()),
                field("interests", "multiSelect", false, FieldConstraints.builder().options(List.of("music", "sports", "art")).build()),
                field("avatar", "file", false),
                field("token", "hidden", false),
                field("nonce", "hidden", false, FieldConstraints.builder().pattern("[0-9a-f]{8}").build()));
    }
}
