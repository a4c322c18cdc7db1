package com.team.formtest.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Test data generation settings.
 */
@Configuration
@ConfigurationProperties(prefix = "form-test.generation")
@Getter
@Setter
public class GenerationConfig {

    /** Try the Claude-backed generator before the rule-based one */
    private boolean aiEnabled = false;

    /** Upper bound for one AI generation call */
    private int aiTimeoutSeconds = 20;

    /** Seed used for every run when set; otherwise each run draws its own */
    private Long fixedSeed;
}
