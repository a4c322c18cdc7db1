package com.team.formtest.exception;

public class ElementNotFoundException extends RuntimeException {

    public ElementNotFoundException(String locator) {
        super("Element not found: " + locator);
    }
}
