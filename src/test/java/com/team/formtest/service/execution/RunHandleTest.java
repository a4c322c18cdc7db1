package com.team.formtest.service.execution;

import com.team.formtest.TestForms;
import com.team.formtest.exception.RunCancelledException;
import com.team.formtest.model.generation.Scenario;
import com.team.formtest.model.run.CancelAck;
import com.team.formtest.model.run.ErrorKind;
import com.team.formtest.model.run.RunStatus;
import com.team.formtest.model.run.Screenshot;
import com.team.formtest.model.run.ScreenshotStage;
import com.team.formtest.model.run.TestRun;
import com.team.formtest.service.browser.FakeBrowserSession;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunHandleTest {

    private final List<TestRun> finished = new ArrayList<>();
    private final RunHandle run = new RunHandle("r1", TestForms.signup(), Scenario.VALID, 1L, finished::add);

    @Test
    void startsPendingWithoutTimestamps() {
        TestRun snapshot = run.snapshot();

        assertThat(snapshot.getStatus()).isEqualTo(RunStatus.PENDING);
        assertThat(snapshot.getStartedAt()).isNull();
        assertThat(snapshot.getFinishedAt()).isNull();
        assertThat(snapshot.getMetadataRef()).isEqualTo("signup");
    }

    @Test
    void completesOnlyOnce() {
        run.markRunning(Duration.ofMinutes(1));

        assertThat(run.complete(RunStatus.PASSED, null, null)).isTrue();
        assertThat(run.complete(RunStatus.ERRORED, ErrorKind.INFRASTRUCTURE, "late")).isFalse();

        assertThat(run.getStatus()).isEqualTo(RunStatus.PASSED);
        assertThat(finished).hasSize(1);
        assertThat(finished.get(0).getFinishedAt()).isNotNull();
        assertThat(finished.get(0).getErrorKind()).isNull();
    }

    @Test
    void rejectsNonTerminalCompletion() {
        assertThatThrownBy(() -> run.complete(RunStatus.RUNNING, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancellingAPendingRunFinishesItAtOnce() {
        assertThat(run.requestCancel(ErrorKind.CANCELLED_BY_USER)).isEqualTo(CancelAck.CANCEL_REQUESTED);

        assertThat(run.getStatus()).isEqualTo(RunStatus.CANCELLED);
        assertThat(run.snapshot().getErrorKind()).isEqualTo(ErrorKind.CANCELLED_BY_USER);
        assertThat(run.markRunning(Duration.ofMinutes(1))).isFalse();
    }

    @Test
    void cancellingARunningRunTakesEffectAtTheNextCheckpoint() {
        run.markRunning(Duration.ofMinutes(1));
        run.checkpoint();

        assertThat(run.requestCancel(ErrorKind.CANCELLED_BY_USER)).isEqualTo(CancelAck.CANCEL_REQUESTED);

        assertThat(run.getStatus()).isEqualTo(RunStatus.RUNNING);
        assertThatThrownBy(run::checkpoint)
                .isInstanceOfSatisfying(RunCancelledException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CANCELLED_BY_USER));
    }

    @Test
    void cancellingAFinishedRunIsANoOp() {
        run.markRunning(Duration.ofMinutes(1));
        run.complete(RunStatus.FAILED, ErrorKind.OUTCOME_MISMATCH, "mismatch");

        assertThat(run.requestCancel(ErrorKind.CANCELLED_BY_USER)).isEqualTo(CancelAck.ALREADY_TERMINAL);

        TestRun snapshot = run.snapshot();
        assertThat(snapshot.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(snapshot.getErrorKind()).isEqualTo(ErrorKind.OUTCOME_MISMATCH);
        assertThat(finished).hasSize(1);
    }

    @Test
    void passedDeadlineFailsTheCheckpoint() throws InterruptedException {
        run.markRunning(Duration.ofMillis(1));
        Thread.sleep(20);

        assertThatThrownBy(run::checkpoint)
                .isInstanceOfSatisfying(RunCancelledException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.RUN_TIMEOUT));
    }

    @Test
    void completionReleasesTheSession() {
        FakeBrowserSession session = new FakeBrowserSession();
        run.markRunning(Duration.ofMinutes(1));
        run.attachSession(session);

        run.complete(RunStatus.PASSED, null, null);
        run.releaseSession();

        assertThat(session.closeCount()).isEqualTo(1);
    }

    @Test
    void sessionAttachedAfterFinishIsClosedImmediately() {
        FakeBrowserSession session = new FakeBrowserSession();
        run.requestCancel(ErrorKind.CANCELLED_BY_USER);

        assertThatThrownBy(() -> run.attachSession(session)).isInstanceOf(RunCancelledException.class);
        assertThat(session.isClosed()).isTrue();
    }

    @Test
    void keepsAtMostOneErrorScreenshot() {
        run.markRunning(Duration.ofMinutes(1));

        assertThat(run.addScreenshot(new Screenshot(ScreenshotStage.ERROR, "a", LocalDateTime.now()))).isTrue();
        assertThat(run.addScreenshot(new Screenshot(ScreenshotStage.ERROR, "b", LocalDateTime.now()))).isFalse();

        assertThat(run.snapshot().getScreenshots()).hasSize(1);
    }

    @Test
    void ignoresUpdatesAfterFinishing() {
        run.markRunning(Duration.ofMinutes(1));
        run.complete(RunStatus.PASSED, null, null);

        assertThat(run.addScreenshot(new Screenshot(ScreenshotStage.AFTER_SUBMIT, "x", LocalDateTime.now()))).isFalse();
        assertThat(run.snapshot().getScreenshots()).isEmpty();
    }
}
