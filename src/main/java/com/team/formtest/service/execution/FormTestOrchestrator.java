package com.team.formtest.service.execution;

import com.team.formtest.exception.ActionTimeoutException;
import com.team.formtest.exception.ElementNotFoundException;
import com.team.formtest.exception.RunCancelledException;
import com.team.formtest.exception.SubmissionUnknownException;
import com.team.formtest.exception.ValueRejectedException;
import com.team.formtest.model.form.FieldSpec;
import com.team.formtest.model.form.FormMetadata;
import com.team.formtest.model.generation.GeneratedValue;
import com.team.formtest.model.run.ErrorKind;
import com.team.formtest.model.run.RunStatus;
import com.team.formtest.model.run.Screenshot;
import com.team.formtest.model.run.ScreenshotStage;
import com.team.formtest.model.run.StepAction;
import com.team.formtest.model.run.StepResult;
import com.team.formtest.model.run.StepStatus;
import com.team.formtest.model.run.SubmissionOutcome;
import com.team.formtest.service.browser.BrowserAction;
import com.team.formtest.service.browser.BrowserSession;
import com.team.formtest.service.browser.BrowserSessionProvider;
import com.team.formtest.service.browser.ElementRef;
import com.team.formtest.service.catalog.FieldTypeCatalog;
import com.team.formtest.service.generation.DataSynthesizer;
import com.team.formtest.service.interaction.InteractionStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the phases of one test run on the calling thread:
 * navigate, capture(before), fields in form order, capture(after-fill), submit,
 * capture(after-submit), judge the outcome.
 *
 * A failing field is recorded and the run moves on. Cancellation and timeout are
 * observed before every browser call. Whatever happens, the run ends in exactly one
 * terminal status and its browser session is released.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FormTestOrchestrator {

    static final String DEFAULT_SUBMIT_LOCATOR = "button[type=submit], input[type=submit]";

    private final BrowserSessionProvider sessionProvider;
    private final InteractionStrategy strategy;
    private final FieldTypeCatalog catalog;
    private final DataSynthesizer synthesizer;
    private final OutcomeJudge judge;

    public void execute(RunHandle run) {
        String runId = run.getId();
        FormMetadata metadata = run.getMetadata();
        BrowserSession rawSession = null;
        log.info("[{}] Run started: form={} scenario={} seed={}", runId, metadata.getId(), run.getScenario(), run.getSeed());

        try {
            run.checkpoint();
            if (run.getGeneratedValues() == null) {
                run.setGeneratedValues(synthesizer.planRun(metadata, run.getScenario(), run.getSeed()));
            }
            List<GeneratedValue> values = run.getGeneratedValues();

            run.checkpoint();
            rawSession = sessionProvider.open(runId);
            run.attachSession(rawSession);
            BrowserSession session = new GuardedBrowserSession(rawSession, run);

            session.navigate(metadata.getPageUrl());
            capture(run, session, ScreenshotStage.BEFORE);

            List<String> failedRequired = new ArrayList<>();
            List<String> rejectedByUi = new ArrayList<>();
            List<FieldSpec> fields = metadata.getFields();
            for (int i = 0; i < fields.size(); i++) {
                FieldSpec field = fields.get(i);
                GeneratedValue value = i < values.size() ? values.get(i) : null;
                StepResult step = applyField(run, session, field, value);
                run.addStep(step);
                if (step.getStatus() == StepStatus.VALUE_REJECTED_BY_UI && value != null && value.expectsReject()) {
                    // the input refused a value meant to be refused
                    rejectedByUi.add(field.getName());
                } else if (step.getStatus() != StepStatus.OK && field.isRequired()) {
                    failedRequired.add(field.getName());
                }
            }
            capture(run, session, ScreenshotStage.AFTER_FILL);

            submit(run, session, metadata);
            capture(run, session, ScreenshotStage.AFTER_SUBMIT);

            SubmissionOutcome outcome = session.readSubmissionOutcome();
            log.info("[{}] Submission outcome: {}", runId, outcome);
            Verdict verdict = judge.judge(values, outcome, failedRequired, rejectedByUi);
            if (verdict.getStatus() == RunStatus.ERRORED) {
                throw new SubmissionUnknownException(verdict.getSummary());
            }
            run.complete(verdict.getStatus(), verdict.getErrorKind(), verdict.getSummary());

        } catch (RunCancelledException e) {
            log.warn("[{}] {}", runId, e.getMessage());
            captureError(run, rawSession);
            run.complete(RunStatus.CANCELLED, e.getKind(), e.getMessage());
        } catch (SubmissionUnknownException e) {
            log.warn("[{}] Submission outcome unknown: {}", runId, e.getMessage());
            captureError(run, rawSession);
            run.complete(RunStatus.ERRORED, ErrorKind.SUBMISSION_UNKNOWN, e.getMessage());
        } catch (Exception e) {
            log.error("[{}] Run failed: {}", runId, e.getMessage(), e);
            captureError(run, rawSession);
            run.complete(RunStatus.ERRORED, ErrorKind.INFRASTRUCTURE,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        } finally {
            run.releaseSession();
        }
    }

    private StepResult applyField(RunHandle run, BrowserSession session, FieldSpec field, GeneratedValue value) {
        String fieldType = catalog.resolve(field).getSemanticType().getValue();
        List<BrowserAction> actions = strategy.actionsFor(field, value);
        StepAction stepAction = actions.get(0).stepAction();

        StepResult.StepResultBuilder step = StepResult.builder()
                .fieldName(field.getName())
                .fieldType(fieldType)
                .action(stepAction);

        if (stepAction == StepAction.SKIP) {
            log.debug("[{}] Skipping field '{}': {}", run.getId(), field.getName(), actions.get(0).getValue());
            return step.status(StepStatus.OK).timestampOffsetMs(run.elapsedMs()).detail(actions.get(0).getValue()).build();
        }

        try {
            for (BrowserAction action : actions) {
                String locator = action.getTarget() != null ? action.getTarget() : field.getLocator();
                ElementRef element = session.locate(locator)
                        .orElseThrow(() -> new ElementNotFoundException(locator));
                strategy.perform(session, element, action);
            }
            step.status(StepStatus.OK);
        } catch (ElementNotFoundException e) {
            log.warn("[{}] Field '{}': {}", run.getId(), field.getName(), e.getMessage());
            step.status(StepStatus.ELEMENT_NOT_FOUND).detail(e.getMessage());
        } catch (ActionTimeoutException e) {
            log.warn("[{}] Field '{}' timed out: {}", run.getId(), field.getName(), e.getMessage());
            step.status(StepStatus.TIMEOUT).detail(e.getMessage());
        } catch (ValueRejectedException e) {
            log.warn("[{}] Field '{}' rejected the value: {}", run.getId(), field.getName(), e.getMessage());
            step.status(StepStatus.VALUE_REJECTED_BY_UI).detail(e.getMessage());
        }
        return step.timestampOffsetMs(run.elapsedMs()).build();
    }

    /**
     * Click the submit control. A missing or unusable control is recorded as a step and
     * makes the outcome unknowable.
     */
    private void submit(RunHandle run, BrowserSession session, FormMetadata metadata) {
        String locator = metadata.getSubmitLocator() != null && !metadata.getSubmitLocator().isBlank()
                ? metadata.getSubmitLocator() : DEFAULT_SUBMIT_LOCATOR;
        StepStatus failure;
        String detail;
        try {
            ElementRef button = session.locate(locator)
                    .orElseThrow(() -> new ElementNotFoundException(locator));
            session.act(button, BrowserAction.click());
            return;
        } catch (ElementNotFoundException e) {
            failure = StepStatus.ELEMENT_NOT_FOUND;
            detail = e.getMessage();
        } catch (ActionTimeoutException e) {
            failure = StepStatus.TIMEOUT;
            detail = e.getMessage();
        } catch (ValueRejectedException e) {
            failure = StepStatus.VALUE_REJECTED_BY_UI;
            detail = e.getMessage();
        }
        run.addStep(StepResult.builder()
                .fieldName("submit")
                .fieldType("submit")
                .action(StepAction.SUBMIT)
                .status(failure)
                .timestampOffsetMs(run.elapsedMs())
                .detail(detail)
                .build());
        throw new SubmissionUnknownException("Submit failed: " + detail);
    }

    private void capture(RunHandle run, BrowserSession session, ScreenshotStage stage) {
        try {
            String reference = session.capture(stage);
            run.addScreenshot(new Screenshot(stage, reference, LocalDateTime.now()));
        } catch (RunCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("[{}] Screenshot {} failed: {}", run.getId(), stage, e.getMessage());
        }
    }

    /**
     * Best effort: a failure here is logged and never replaces the original error.
     */
    private void captureError(RunHandle run, BrowserSession rawSession) {
        if (rawSession == null || run.isTerminal() || run.hasErrorScreenshot()) {
            return;
        }
        try {
            String reference = rawSession.capture(ScreenshotStage.ERROR);
            run.addScreenshot(new Screenshot(ScreenshotStage.ERROR, reference, LocalDateTime.now()));
        } catch (RuntimeException e) {
            log.warn("[{}] Error screenshot failed: {}", run.getId(), e.getMessage());
        }
    }
}
