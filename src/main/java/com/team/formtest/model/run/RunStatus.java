package com.team.formtest.model.run;

/**
 * Lifecycle of a test run. PASSED, FAILED, ERRORED and CANCELLED are terminal.
 */
public enum RunStatus {
    PENDING,    // accepted, waiting for a worker
    RUNNING,    // phases executing
    PASSED,     // form behaved as the generated values predicted
    FAILED,     // form behaved differently, or a required field could not be filled
    ERRORED,    // test infrastructure failed, outcome could not be judged
    CANCELLED;  // cancelled by a caller or by the run timeout

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }
}
