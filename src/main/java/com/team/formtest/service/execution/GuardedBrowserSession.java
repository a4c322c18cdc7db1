package com.team.formtest.service.execution;

import com.team.formtest.model.run.ScreenshotStage;
import com.team.formtest.model.run.SubmissionOutcome;
import com.team.formtest.service.browser.BrowserAction;
import com.team.formtest.service.browser.BrowserSession;
import com.team.formtest.service.browser.ElementRef;

import java.util.Optional;

/**
 * Checks the run for cancellation and timeout before every browser call, making each
 * call a suspension point.
 */
class GuardedBrowserSession implements BrowserSession {

    private final BrowserSession delegate;
    private final RunHandle run;

    GuardedBrowserSession(BrowserSession delegate, RunHandle run) {
        this.delegate = delegate;
        this.run = run;
    }

    @Override
    public void navigate(String url) {
        run.checkpoint();
        delegate.navigate(url);
    }

    @Override
    public Optional<ElementRef> locate(String locator) {
        run.checkpoint();
        return delegate.locate(locator);
    }

    @Override
    public void act(ElementRef element, BrowserAction action) {
        run.checkpoint();
        delegate.act(element, action);
    }

    @Override
    public boolean isChecked(ElementRef element) {
        run.checkpoint();
        return delegate.isChecked(element);
    }

    @Override
    public String capture(ScreenshotStage stage) {
        run.checkpoint();
        return delegate.capture(stage);
    }

    @Override
    public SubmissionOutcome readSubmissionOutcome() {
        run.checkpoint();
        return delegate.readSubmissionOutcome();
    }

    @Override
    public void close() {
        delegate.close();
    }
}
