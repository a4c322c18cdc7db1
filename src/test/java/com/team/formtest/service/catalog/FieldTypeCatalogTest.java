package com.team.formtest.service.catalog;

import com.team.formtest.TestForms;
import com.team.formtest.exception.UnsupportedFieldTypeException;
import com.team.formtest.model.form.SemanticType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldTypeCatalogTest {

    private final FieldTypeCatalog catalog = new FieldTypeCatalog();

    @ParameterizedTest
    @EnumSource(SemanticType.class)
    void everyTypeHasRules(SemanticType type) {
        FieldRules rules = catalog.rulesFor(type);

        assertThat(rules.getSemanticType()).isEqualTo(type);
        assertThat(rules.getGenerationRule()).isNotNull();
        assertThat(rules.getInteractionRule()).isNotNull();
    }

    @Test
    void resolvesDeclaredNamesLoosely() {
        assertThat(catalog.rulesFor("multi-select").getSemanticType()).isEqualTo(SemanticType.MULTI_SELECT);
        assertThat(catalog.rulesFor("EMAIL").getSemanticType()).isEqualTo(SemanticType.EMAIL);
        assertThat(catalog.rulesFor("date_time").getSemanticType()).isEqualTo(SemanticType.DATETIME);
    }

    @Test
    void interactionRulesFollowTheType() {
        assertThat(catalog.rulesFor(SemanticType.EMAIL).getInteractionRule()).isEqualTo(InteractionRule.TYPE_TEXT);
        assertThat(catalog.rulesFor(SemanticType.CHECKBOX).getInteractionRule()).isEqualTo(InteractionRule.TOGGLE);
        assertThat(catalog.rulesFor(SemanticType.RADIO).getInteractionRule()).isEqualTo(InteractionRule.CHOOSE_RADIO);
        assertThat(catalog.rulesFor(SemanticType.MULTI_SELECT).getInteractionRule()).isEqualTo(InteractionRule.SELECT_MANY);
        assertThat(catalog.rulesFor(SemanticType.FILE).getInteractionRule()).isEqualTo(InteractionRule.UPLOAD);
        assertThat(catalog.rulesFor(SemanticType.HIDDEN).getInteractionRule()).isEqualTo(InteractionRule.SET_HIDDEN);
    }

    @Test
    void unknownNameIsRejectedByLookup() {
        assertThatThrownBy(() -> catalog.rulesFor("signature-pad"))
                .isInstanceOf(UnsupportedFieldTypeException.class)
                .hasMessageContaining("signature-pad");
    }

    @Test
    void unknownFieldTypeResolvesToText() {
        FieldRules rules = catalog.resolve(TestForms.field("sig", "signature-pad", false));

        assertThat(rules.getSemanticType()).isEqualTo(SemanticType.TEXT);
    }
}
