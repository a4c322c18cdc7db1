package com.team.formtest.service.browser;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Handle of a located element. Only meaningful to the session that produced it.
 */
@Getter
@ToString
@AllArgsConstructor
public class ElementRef {

    private final String locator;
}
