package com.team.formtest.service.browser;

import com.team.formtest.model.run.StepAction;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One primitive browser operation on a field.
 * {@code target} overrides the field locator, e.g. a single radio button of a group.
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BrowserAction {

    public enum Type {
        FILL,           // type text into an input
        SET_VALUE,      // assign the value by script, for hidden inputs
        CLICK,
        CHECK,          // reach the checked state
        UNCHECK,        // reach the unchecked state
        SELECT,         // replace the selection with one option, null clears it
        ADD_OPTION,     // add one option to a multi-select
        UPLOAD,         // attach a synthesized file, null clears it
        SKIP
    }

    private final Type type;
    private final String value;
    private final String target;

    public static BrowserAction fill(String text) {
        return new BrowserAction(Type.FILL, text, null);
    }

    public static BrowserAction setValue(String text) {
        return new BrowserAction(Type.SET_VALUE, text, null);
    }

    public static BrowserAction click() {
        return new BrowserAction(Type.CLICK, null, null);
    }

    public static BrowserAction check(String target) {
        return new BrowserAction(Type.CHECK, null, target);
    }

    public static BrowserAction uncheck(String target) {
        return new BrowserAction(Type.UNCHECK, null, target);
    }

    public static BrowserAction select(String option) {
        return new BrowserAction(Type.SELECT, option, null);
    }

    public static BrowserAction addOption(String option) {
        return new BrowserAction(Type.ADD_OPTION, option, null);
    }

    public static BrowserAction upload(String fileName) {
        return new BrowserAction(Type.UPLOAD, fileName, null);
    }

    public static BrowserAction skip(String reason) {
        return new BrowserAction(Type.SKIP, reason, null);
    }

    /**
     * How the action is reported in a step result.
     */
    public StepAction stepAction() {
        return switch (type) {
            case FILL, SET_VALUE -> StepAction.FILL;
            case CLICK, CHECK, UNCHECK -> StepAction.CHECK;
            case SELECT, ADD_OPTION -> StepAction.SELECT;
            case UPLOAD -> StepAction.UPLOAD;
            case SKIP -> StepAction.SKIP;
        };
    }
}
