package com.team.formtest.service.interaction;

import com.team.formtest.TestForms;
import com.team.formtest.model.form.FieldConstraints;
import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.generation.FieldValue;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.Scenario;
import com.team.formtest.service.browser.BrowserAction;
import com.team.formtest.service.browser.ElementRef;
import com.team.formtest.service.browser.FakeBrowserSession;
import com.team.formtest.service.catalog.FieldTypeCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InteractionStrategyTest {

    private final InteractionStrategy strategy = new InteractionStrategy(new FieldTypeCatalog());

    @Test
    void textLikeFieldsAreFilled() {
        List<BrowserAction> actions = strategy.actionsFor(TestForms.email(), valid("email", FieldValue.ofText("a@b.co")));

        assertThat(actions).containsExactly(BrowserAction.fill("a@b.co"));
    }

    @Test
    void numbersAreTypedAsText() {
        List<BrowserAction> actions = strategy.actionsFor(TestForms.age(), valid("age", FieldValue.ofNumber(42)));

        assertThat(actions).containsExactly(BrowserAction.fill("42"));
    }

    @Test
    void hiddenFieldsAreSetByScript() {
        FieldSpec token = TestForms.field("token", "hidden", false);

        assertThat(strategy.actionsFor(token, valid("token", FieldValue.ofText("abc"))))
                .containsExactly(BrowserAction.setValue("abc"));
    }

    @Test
    void checkboxTargetsTheRequestedState() {
        FieldSpec terms = TestForms.field("terms", "checkbox", true);

        assertThat(strategy.actionsFor(terms, valid("terms", FieldValue.ofBoolean(true))))
                .containsExactly(BrowserAction.check(null));
        assertThat(strategy.actionsFor(terms, valid("terms", FieldValue.ofBoolean(false))))
                .containsExactly(BrowserAction.uncheck(null));
    }

    @Test
    void radioChecksTheMatchingButtonOfTheGroup() {
        FieldSpec gender = TestForms.field("gender", "radio", true,
                FieldConstraints.builder().options(List.of("male", "female")).build());

        List<BrowserAction> actions = strategy.actionsFor(gender, valid("gender", FieldValue.ofText("female")));

        assertThat(actions).containsExactly(BrowserAction.check("#gender[value=\"female\"]"));
    }

    @Test
    void emptyRadioChoiceIsSkipped() {
        FieldSpec gender = TestForms.field("gender", "radio", true);

        List<BrowserAction> actions = strategy.actionsFor(gender, valid("gender", FieldValue.ofText("")));

        assertThat(actions).extracting(BrowserAction::getType).containsExactly(BrowserAction.Type.SKIP);
    }

    @Test
    void multiSelectReplacesThenAddsOptions() {
        FieldSpec tags = TestForms.field("tags", "multiSelect", false);

        List<BrowserAction> actions = strategy.actionsFor(tags, valid("tags", FieldValue.ofOptions(List.of("a", "b", "c"))));

        assertThat(actions).containsExactly(
                BrowserAction.select("a"), BrowserAction.addOption("b"), BrowserAction.addOption("c"));
    }

    @Test
    void emptyMultiSelectClearsTheSelection() {
        FieldSpec tags = TestForms.field("tags", "multiSelect", false);

        assertThat(strategy.actionsFor(tags, valid("tags", FieldValue.ofOptions(List.of()))))
                .containsExactly(BrowserAction.select(null));
    }

    @Test
    void filesAreUploaded() {
        FieldSpec avatar = TestForms.field("avatar", "file", false);

        assertThat(strategy.actionsFor(avatar, valid("avatar", FieldValue.ofText("photo.png"))))
                .containsExactly(BrowserAction.upload("photo.png"));
    }

    @Test
    void notApplicableValueIsSkipped() {
        GeneratedValue skipped = GeneratedValue.notApplicable("notes", Scenario.INVALID, "no constraint to break");

        List<BrowserAction> actions = strategy.actionsFor(TestForms.field("notes", "text", false), skipped);

        assertThat(actions).containsExactly(BrowserAction.skip("no constraint to break"));
    }

    @Test
    void checkingTwiceLeavesTheBoxChecked() {
        FakeBrowserSession session = new FakeBrowserSession().checked("#terms", false);
        ElementRef terms = new ElementRef("#terms");

        strategy.perform(session, terms, BrowserAction.check(null));
        strategy.perform(session, terms, BrowserAction.check(null));

        assertThat(session.isCheckedNow("#terms")).isTrue();
        assertThat(session.calls()).filteredOn(c -> c.startsWith("act:CLICK")).hasSize(1);
    }

    @Test
    void uncheckingAnUncheckedBoxDoesNothing() {
        FakeBrowserSession session = new FakeBrowserSession().checked("#news", false);

        strategy.perform(session, new ElementRef("#news"), BrowserAction.uncheck(null));

        assertThat(session.isCheckedNow("#news")).isFalse();
        assertThat(session.calls()).containsExactly("isChecked:#news");
    }

    @Test
    void skipTouchesNothing() {
        FakeBrowserSession session = new FakeBrowserSession();

        strategy.perform(session, new ElementRef("#x"), BrowserAction.skip("n/a"));

        assertThat(session.calls()).isEmpty();
    }

    private static GeneratedValue valid(String field, FieldValue value) {
        return GeneratedValue.accept(field, Scenario.VALID, value, "test");
    }
}
