package com.team.formtest.service.execution;

import com.team.formtest.exception.RunCancelledException;
import com.team.formtest.model.form.FormMetadata;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.generation.Scenario;
import com.team.formtest.model.run.CancelAck;
import com.team.formtest.model.run.ErrorKind;
import com.team.formtest.model.run.RunStatus;
import com.team.formtest.model.run.Screenshot;
import com.team.formtest.model.run.ScreenshotStage;
import com.team.formtest.model.run.StepResult;
import com.team.formtest.model.run.TestRun;
import com.team.formtest.service.browser.BrowserSession;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Live state of one test run, shared by its worker, the watchdog and callers.
 *
 * All mutation goes through synchronized methods. The transition into a terminal
 * status happens exactly once; afterwards the run ignores further updates.
 */
@Slf4j
public class RunHandle {

    @Getter
    private final String id;
    @Getter
    private final FormMetadata metadata;
    @Getter
    private final Scenario scenario;
    @Getter
    private final long seed;
    private final LocalDateTime createdAt;
    private final Consumer<TestRun> onTerminal;

    private RunStatus status = RunStatus.PENDING;
    private List<GeneratedValue> generatedValues;
    private final List<StepResult> steps = new ArrayList<>();
    private final List<Screenshot> screenshots = new ArrayList<>();
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private long startedNanos;
    private long deadlineNanos = Long.MAX_VALUE;
    private ErrorKind errorKind;
    private String errorSummary;

    private volatile ErrorKind cancelRequested;
    private BrowserSession session;
    private Future<?> future;

    public RunHandle(String id, FormMetadata metadata, Scenario scenario, long seed, Consumer<TestRun> onTerminal) {
        this.id = id;
        this.metadata = metadata;
        this.scenario = scenario;
        this.seed = seed;
        this.onTerminal = onTerminal;
        this.createdAt = LocalDateTime.now();
    }

    /**
     * PENDING to RUNNING. Returns false when the run was already finished, e.g. cancelled in the queue.
     */
    public synchronized boolean markRunning(Duration timeout) {
        if (status != RunStatus.PENDING) {
            return false;
        }
        status = RunStatus.RUNNING;
        startedAt = LocalDateTime.now();
        startedNanos = System.nanoTime();
        deadlineNanos = startedNanos + timeout.toNanos();
        return true;
    }

    /**
     * Suspension point check: throws once cancellation was requested or the deadline passed.
     */
    public void checkpoint() {
        ErrorKind requested = cancelRequested;
        if (requested != null) {
            throw new RunCancelledException(requested, describe(requested));
        }
        if (System.nanoTime() - deadlineNanos > 0) {
            throw new RunCancelledException(ErrorKind.RUN_TIMEOUT, describe(ErrorKind.RUN_TIMEOUT));
        }
    }

    /**
     * Ask the run to stop. A queued run is cancelled right away; a running one stops at
     * its next suspension point; a finished one is left untouched.
     */
    public CancelAck requestCancel(ErrorKind reason) {
        synchronized (this) {
            if (status.isTerminal()) {
                return CancelAck.ALREADY_TERMINAL;
            }
            if (status == RunStatus.RUNNING) {
                if (cancelRequested == null) {
                    cancelRequested = reason;
                }
                return CancelAck.CANCEL_REQUESTED;
            }
        }
        complete(RunStatus.CANCELLED, reason, describe(reason) + " before start");
        return CancelAck.CANCEL_REQUESTED;
    }

    /**
     * Move to a terminal status. Only the first call has an effect; it releases the
     * browser session and notifies the completion listener.
     *
     * @return true when this call performed the transition
     */
    public boolean complete(RunStatus terminal, ErrorKind kind, String summary) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        TestRun finished;
        synchronized (this) {
            if (status.isTerminal()) {
                return false;
            }
            status = terminal;
            errorKind = kind;
            errorSummary = summary;
            finishedAt = LocalDateTime.now();
            if (startedAt == null) {
                startedAt = finishedAt;
            }
            finished = snapshot();
        }
        log.info("[{}] Run finished: {}{}", id, terminal, summary != null ? " (" + summary + ")" : "");
        releaseSession();
        onTerminal.accept(finished);
        return true;
    }

    public synchronized boolean isTerminal() {
        return status.isTerminal();
    }

    public synchronized RunStatus getStatus() {
        return status;
    }

    public synchronized List<GeneratedValue> getGeneratedValues() {
        return generatedValues;
    }

    public synchronized void setGeneratedValues(List<GeneratedValue> values) {
        if (!status.isTerminal()) {
            this.generatedValues = List.copyOf(values);
        }
    }

    public synchronized void addStep(StepResult step) {
        if (!status.isTerminal()) {
            steps.add(step);
        }
    }

    /**
     * @return false when ignored: the run is finished, or an error screenshot already exists
     */
    public synchronized boolean addScreenshot(Screenshot screenshot) {
        if (status.isTerminal() || (screenshot.getStage() == ScreenshotStage.ERROR && hasErrorScreenshot())) {
            return false;
        }
        screenshots.add(screenshot);
        return true;
    }

    public synchronized boolean hasErrorScreenshot() {
        return screenshots.stream().anyMatch(s -> s.getStage() == ScreenshotStage.ERROR);
    }

    public synchronized long elapsedMs() {
        return startedAt == null ? 0L : (System.nanoTime() - startedNanos) / 1_000_000L;
    }

    /**
     * Bind the run's browser session. A run finished in the meantime closes it at once.
     */
    public void attachSession(BrowserSession opened) {
        boolean closeNow;
        synchronized (this) {
            closeNow = status.isTerminal();
            if (!closeNow) {
                session = opened;
            }
        }
        if (closeNow) {
            closeQuietly(opened);
            throw new RunCancelledException(errorKindOrDefault(), "Run finished before its browser session opened");
        }
    }

    /**
     * Close the session if one is held. Idempotent.
     */
    public void releaseSession() {
        BrowserSession held;
        synchronized (this) {
            held = session;
            session = null;
        }
        if (held != null) {
            closeQuietly(held);
        }
    }

    public synchronized void setFuture(Future<?> future) {
        this.future = future;
    }

    /**
     * Interrupt the worker. Used only as the hard timeout backstop.
     */
    public void interruptWorker() {
        Future<?> held;
        synchronized (this) {
            held = future;
        }
        if (held != null) {
            held.cancel(true);
        }
    }

    public synchronized TestRun snapshot() {
        return TestRun.builder()
                .id(id)
                .metadataRef(metadata.getId())
                .scenario(scenario)
                .status(status)
                .seed(seed)
                .generatedValues(generatedValues != null ? List.copyOf(generatedValues) : List.of())
                .steps(List.copyOf(steps))
                .screenshots(List.copyOf(screenshots))
                .createdAt(createdAt)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .errorKind(errorKind)
                .errorSummary(errorSummary)
                .build();
    }

    private synchronized ErrorKind errorKindOrDefault() {
        return errorKind != null ? errorKind : ErrorKind.CANCELLED_BY_USER;
    }

    private void closeQuietly(BrowserSession held) {
        try {
            held.close();
        } catch (RuntimeException e) {
            log.warn("[{}] Releasing browser session failed: {}", id, e.getMessage());
        }
    }

    private static String describe(ErrorKind reason) {
        return reason == ErrorKind.RUN_TIMEOUT ? "Run timed out" : "Run cancelled";
    }
}
