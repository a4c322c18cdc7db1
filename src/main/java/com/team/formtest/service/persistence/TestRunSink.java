package com.team.formtest.service.persistence;

import com.team.formtest.model.run.TestRun;

/**
 * Durable storage for finished runs and their screenshot references. Write-only.
 */
public interface TestRunSink {

    void store(TestRun run);
}
