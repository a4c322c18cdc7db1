package com.team.formtest.service.catalog;

import com.team.formtest.model.form.SemanticType;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class FieldRules {

    private final SemanticType semanticType;
    private final GenerationRule generationRule;
    private final InteractionRule interactionRule;
}
