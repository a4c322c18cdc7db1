package com.team.formtest.model.generation;

public enum ExpectedOutcome {
    ACCEPT,
    REJECT
}
