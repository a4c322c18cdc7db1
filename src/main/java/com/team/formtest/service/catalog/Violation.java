package com.team.formtest.service.catalog;

/**
 * Constraint dimensions a value can break.
 */
public enum Violation {
    FORMAT,      // intrinsic format of the type: email, url, number, date ...
    PATTERN,
    MIN_LENGTH,
    MAX_LENGTH,
    RANGE,
    OPTION,
    REQUIRED
}
