package com.team.formtest.service.execution;

import com.team.formtest.config.ExecutionConfig;
import com.team.formtest.exception.NotFoundException;
import com.team.formtest.exception.OverloadedException;
import com.team.formtest.model.form.FormMetadata;
import com.team.formtest.model.generation.Scenario;
import com.team.formtest.model.run.CancelAck;
import com.team.formtest.model.run.ErrorKind;
import com.team.formtest.model.run.RunStatus;
import com.team.formtest.model.run.TestRun;
import com.team.formtest.service.generation.DataSynthesizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;

/**
 * Accepts run requests and drives them through the orchestrator on the bounded
 * {@code formRunExecutor} pool. Runs beyond the concurrency limit wait in FIFO order.
 *
 * Each running run gets two watchdog timers: at the timeout it is asked to stop at
 * its next suspension point; after the grace period it is forced to CANCELLED and
 * its worker interrupted.
 */
@Service
@Slf4j
public class RunScheduler {

    private final FormTestOrchestrator orchestrator;
    private final DataSynthesizer synthesizer;
    private final ThreadPoolTaskExecutor executor;
    private final ExecutionConfig config;
    private final List<RunCompletionListener> listeners;
    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();
    private final ThreadPoolTaskScheduler watchdog;

    public RunScheduler(FormTestOrchestrator orchestrator,
                        DataSynthesizer synthesizer,
                        @Qualifier("formRunExecutor") ThreadPoolTaskExecutor executor,
                        @Qualifier("runWatchdogScheduler") ThreadPoolTaskScheduler watchdog,
                        ExecutionConfig config,
                        List<RunCompletionListener> listeners) {
        this.orchestrator = orchestrator;
        this.synthesizer = synthesizer;
        this.executor = executor;
        this.config = config;
        this.listeners = listeners;
        this.watchdog = watchdog;
    }

    /**
     * One PENDING handle per scenario, returned without waiting for any run.
     * Never throws for load reasons: a run refused by a full queue comes back ERRORED.
     */
    public List<TestRun> submitRun(FormMetadata metadata, Collection<Scenario> scenarios) {
        if (metadata == null || metadata.getFields() == null) {
            throw new IllegalArgumentException("Form metadata with fields is required");
        }
        List<TestRun> handles = new ArrayList<>();
        for (Scenario scenario : scenarios) {
            String runId = UUID.randomUUID().toString().substring(0, 8);
            RunHandle run = new RunHandle(runId, metadata, scenario, synthesizer.nextSeed(), this::onTerminal);
            runs.put(runId, run);
            log.info("[{}] Run queued: form={} scenario={}", runId, metadata.getId(), scenario);
            try {
                enqueue(run);
            } catch (OverloadedException e) {
                log.warn("[{}] {}", runId, e.getMessage());
                run.complete(RunStatus.ERRORED, ErrorKind.OVERLOADED, e.getMessage());
            }
            handles.add(run.snapshot());
        }
        return handles;
    }

    public Optional<TestRun> findRun(String id) {
        RunHandle run = runs.get(id);
        return run != null ? Optional.of(run.snapshot()) : Optional.empty();
    }

    /**
     * @throws NotFoundException for an unknown id
     */
    public TestRun getRun(String id) {
        return findRun(id).orElseThrow(() -> new NotFoundException("Run not found: " + id));
    }

    public List<TestRun> listRuns() {
        return runs.values().stream().map(RunHandle::snapshot).toList();
    }

    public CancelAck cancelRun(String id) {
        RunHandle run = runs.get(id);
        if (run == null) {
            return CancelAck.NOT_FOUND;
        }
        CancelAck ack = run.requestCancel(ErrorKind.CANCELLED_BY_USER);
        log.info("[{}] Cancel requested: {}", id, ack);
        return ack;
    }

    /**
     * Number of runs currently in RUNNING.
     */
    public long runningCount() {
        return runs.values().stream().filter(r -> r.getStatus() == RunStatus.RUNNING).count();
    }

    private void enqueue(RunHandle run) {
        try {
            Future<?> future = executor.submit(() -> work(run));
            run.setFuture(future);
        } catch (TaskRejectedException e) {
            throw new OverloadedException("Run queue is full (capacity " + config.getQueueCapacity() + ")", e);
        }
    }

    private void work(RunHandle run) {
        Duration timeout = Duration.ofSeconds(config.getRunTimeoutSeconds());
        if (!run.markRunning(timeout)) {
            log.debug("[{}] Run finished while queued, skipping", run.getId());
            return;
        }
        Instant started = Instant.now();
        ScheduledFuture<?> soft = watchdog.schedule(() -> {
            if (!run.isTerminal()) {
                log.warn("[{}] Run timed out after {}s, cancelling", run.getId(), config.getRunTimeoutSeconds());
                run.requestCancel(ErrorKind.RUN_TIMEOUT);
            }
        }, started.plus(timeout));
        ScheduledFuture<?> hard = watchdog.schedule(() -> forceTerminate(run),
                started.plus(timeout).plusSeconds(config.getHardTimeoutGraceSeconds()));
        try {
            orchestrator.execute(run);
        } finally {
            soft.cancel(false);
            hard.cancel(false);
            if (!run.isTerminal()) {
                // an Error escaped the orchestrator
                run.complete(RunStatus.ERRORED, ErrorKind.INFRASTRUCTURE, "Run ended without a verdict");
            }
        }
    }

    private void forceTerminate(RunHandle run) {
        if (run.complete(RunStatus.CANCELLED, ErrorKind.RUN_TIMEOUT, "Run exceeded its hard timeout")) {
            log.error("[{}] Run did not stop within the grace period, worker interrupted", run.getId());
            run.interruptWorker();
        }
    }

    private void onTerminal(TestRun finished) {
        for (RunCompletionListener listener : listeners) {
            try {
                listener.onRunCompleted(finished);
            } catch (RuntimeException e) {
                log.warn("[{}] Completion listener {} failed: {}",
                        finished.getId(), listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
