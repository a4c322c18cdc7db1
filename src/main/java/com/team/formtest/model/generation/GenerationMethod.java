package com.team.formtest.model.generation;

public enum GenerationMethod {
    RULE,
    AI
}
