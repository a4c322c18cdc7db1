package com.team.formtest.service.browser;

public interface BrowserSessionProvider {

    /**
     * Open a fresh, isolated session for one run.
     */
    BrowserSession open(String runId);
}
