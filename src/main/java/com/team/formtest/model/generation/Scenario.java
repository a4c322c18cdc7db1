package com.team.formtest.model.generation;

/**
 * Intent of a synthesized value set. Drives both generation and the expected judgment.
 */
public enum Scenario {
    VALID,      // satisfies every constraint, form should accept
    INVALID,    // violates exactly one constraint dimension per field
    EDGE_CASE,  // unusual but still valid values
    BOUNDARY    // exact thresholds and one unit beyond
}
