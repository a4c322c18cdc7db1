package com.team.formtest.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Playwright browser settings.
 */
@Configuration
@ConfigurationProperties(prefix = "form-test.browser")
@Getter
@Setter
public class BrowserConfig {

    private boolean headless = true;

    /** System Chromium, e.g. inside Docker; blank uses the Playwright bundled browser */
    private String chromiumPath;

    private String screenshotDir = "screenshots";

    private int navigationTimeoutMs = 15000;
    private int locateTimeoutMs = 5000;
    private int actionTimeoutMs = 5000;

    /** Wait after clicking submit before reading the outcome indicators */
    private int submitSettleMs = 2000;

    private List<String> successIndicators = new ArrayList<>(List.of(
            ".success", ".alert-success", "[role=status]",
            "text=/thank you/i", "text=/submitted/i", "text=/success/i"));

    private List<String> errorIndicators = new ArrayList<>(List.of(
            ".error", ".invalid-feedback", ".alert-error", ".alert-danger",
            "[aria-invalid=true]", "text=/invalid/i"));
}
