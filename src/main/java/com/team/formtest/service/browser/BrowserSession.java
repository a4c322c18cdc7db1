package com.team.formtest.service.browser;

import com.team.formtest.model.run.ScreenshotStage;
import com.team.formtest.model.run.SubmissionOutcome;

import java.util.Optional;

/**
 * The browser operations a test run needs. One session belongs to exactly one run.
 * Every call may block and may throw
 * {@link com.team.formtest.exception.ActionTimeoutException} or
 * {@link com.team.formtest.exception.ValueRejectedException}.
 */
public interface BrowserSession extends AutoCloseable {

    void navigate(String url);

    /**
     * @return empty when no element matches within the locate timeout
     */
    Optional<ElementRef> locate(String locator);

    void act(ElementRef element, BrowserAction action);

    boolean isChecked(ElementRef element);

    /**
     * @return storage reference of the captured image
     */
    String capture(ScreenshotStage stage);

    SubmissionOutcome readSubmissionOutcome();

    /**
     * Release the underlying browser resources. Safe to call more than once.
     */
    @Override
    void close();
}
