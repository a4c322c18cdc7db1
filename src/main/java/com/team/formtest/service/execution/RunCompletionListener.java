package com.team.formtest.service.execution;

import com.team.formtest.model.run.TestRun;

/**
 * Receives every run exactly once, right after it reached a terminal status.
 * Implementations must not block for long: they run on the thread that finished the run.
 */
public interface RunCompletionListener {

    void onRunCompleted(TestRun run);
}
