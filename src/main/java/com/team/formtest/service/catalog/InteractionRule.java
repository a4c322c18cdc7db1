package com.team.formtest.service.catalog;

/**
 * How a field is driven in the browser.
 */
public enum InteractionRule {
    TYPE_TEXT,      // fill the input with the value's text form
    SET_HIDDEN,     // assign the value by script, hidden inputs cannot be typed into
    TOGGLE,         // checkbox: reach the target checked state
    CHOOSE_RADIO,   // check the radio button carrying the chosen option
    SELECT_ONE,     // select one option
    SELECT_MANY,    // select each chosen option
    UPLOAD          // attach a synthesized file
}
