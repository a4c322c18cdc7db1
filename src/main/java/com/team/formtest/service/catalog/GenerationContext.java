package com.team.formtest.service.catalog;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.time.LocalDate;
import java.util.Random;

/**
 * Inputs every generation rule draws from. Holding the random source and the
 * reference date here keeps the rules deterministic for a given seed.
 */
@Getter
@AllArgsConstructor
public class GenerationContext {

    private final Random random;
    private final LocalDate today;
}
