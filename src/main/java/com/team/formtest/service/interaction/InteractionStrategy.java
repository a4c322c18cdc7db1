package com.team.formtest.service.interaction;

import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.generation.FieldValue;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.service.browser.BrowserAction;
import com.team.formtest.service.browser.BrowserSession;
import com.team.formtest.service.browser.ElementRef;
import com.team.formtest.service.catalog.FieldTypeCatalog;
import com.team.formtest.service.catalog.InteractionRule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a field and its generated value into browser actions, and applies them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InteractionStrategy {

    private final FieldTypeCatalog catalog;

    public List<BrowserAction> actionsFor(FieldSpec field, GeneratedValue generated) {
        if (generated == null || !generated.isApplicable() || generated.getValue() == null) {
            return List.of(BrowserAction.skip(generated != null ? generated.getDescription() : "no value"));
        }
        FieldValue value = generated.getValue();
        InteractionRule rule = catalog.resolve(field).getInteractionRule();

        return switch (rule) {
            case TYPE_TEXT -> List.of(BrowserAction.fill(value.asText()));
            case SET_HIDDEN -> List.of(BrowserAction.setValue(value.asText()));
            case TOGGLE -> List.of(value.asBoolean()
                    ? BrowserAction.check(null)
                    : BrowserAction.uncheck(null));
            case CHOOSE_RADIO -> {
                String option = value.asText();
                if (option.isEmpty()) {
                    yield List.of(BrowserAction.skip("no option chosen"));
                }
                yield List.of(BrowserAction.check(radioLocator(field.getLocator(), option)));
            }
            case SELECT_ONE -> List.of(BrowserAction.select(value.asText()));
            case SELECT_MANY -> {
                List<String> options = value.asOptions();
                if (options.isEmpty()) {
                    yield List.of(BrowserAction.select(null));
                }
                List<BrowserAction> actions = new ArrayList<>();
                actions.add(BrowserAction.select(options.get(0)));
                for (String option : options.subList(1, options.size())) {
                    actions.add(BrowserAction.addOption(option));
                }
                yield actions;
            }
            case UPLOAD -> List.of(BrowserAction.upload(value.asText()));
        };
    }

    /**
     * Apply one action to a located element. Check and uncheck read the current state
     * first and click only when it differs, so repeating them never toggles back.
     */
    public void perform(BrowserSession session, ElementRef element, BrowserAction action) {
        switch (action.getType()) {
            case CHECK, UNCHECK -> {
                boolean wanted = action.getType() == BrowserAction.Type.CHECK;
                if (session.isChecked(element) != wanted) {
                    session.act(element, BrowserAction.click());
                } else {
                    log.debug("{} already in the requested state", element.getLocator());
                }
            }
            case SKIP -> {
                // nothing to apply
            }
            default -> session.act(element, action);
        }
    }

    private static String radioLocator(String groupLocator, String option) {
        return groupLocator + "[value=\"" + option.replace("\"", "\\\"") + "\"]";
    }
}
