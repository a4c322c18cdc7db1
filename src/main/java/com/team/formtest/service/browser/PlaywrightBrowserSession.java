package com.team.formtest.service.browser;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.FilePayload;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.team.formtest.config.BrowserConfig;
import com.team.formtest.exception.ActionTimeoutException;
import com.team.formtest.exception.ValueRejectedException;
import com.team.formtest.model.run.ScreenshotStage;
import com.team.formtest.model.run.SubmissionOutcome;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link BrowserSession} on one Playwright page. Not thread-safe: used only by the
 * worker thread of its run.
 */
@Slf4j
class PlaywrightBrowserSession implements BrowserSession {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");

    private final String runId;
    private final Playwright playwright;
    private final Page page;
    private final BrowserConfig config;
    private final Runnable onClose;
    private volatile boolean closed;

    PlaywrightBrowserSession(String runId, Playwright playwright, Page page, BrowserConfig config, Runnable onClose) {
        this.runId = runId;
        this.playwright = playwright;
        this.page = page;
        this.config = config;
        this.onClose = onClose;
    }

    @Override
    public void navigate(String url) {
        log.debug("[{}] Navigating to {}", runId, url);
        try {
            page.navigate(url, new Page.NavigateOptions().setTimeout(config.getNavigationTimeoutMs()));
            page.waitForLoadState(LoadState.DOMCONTENTLOADED);
        } catch (TimeoutError e) {
            throw new ActionTimeoutException("Navigation to " + url + " timed out", e);
        }
    }

    @Override
    public Optional<ElementRef> locate(String locator) {
        try {
            page.locator(locator).first().waitFor(new Locator.WaitForOptions()
                    .setState(WaitForSelectorState.ATTACHED)
                    .setTimeout(config.getLocateTimeoutMs()));
            return Optional.of(new ElementRef(locator));
        } catch (TimeoutError e) {
            return Optional.empty();
        }
    }

    @Override
    public void act(ElementRef element, BrowserAction action) {
        Locator locator = page.locator(element.getLocator()).first();
        try {
            switch (action.getType()) {
                case FILL -> fill(locator, action.getValue());
                case SET_VALUE -> locator.evaluate("(el, v) => { el.value = v; }", action.getValue());
                case CLICK -> locator.click();
                case CHECK -> locator.check();
                case UNCHECK -> locator.uncheck();
                case SELECT -> select(locator, action.getValue());
                case ADD_OPTION -> addOption(locator, action.getValue());
                case UPLOAD -> upload(locator, action.getValue());
                case SKIP -> {
                    // nothing to do
                }
            }
        } catch (TimeoutError e) {
            throw new ActionTimeoutException(action.getType() + " on " + element.getLocator() + " timed out", e);
        } catch (PlaywrightException e) {
            throw new ValueRejectedException(action.getType() + " on " + element.getLocator() + " failed: "
                    + firstLine(e.getMessage()), e);
        }
    }

    @Override
    public boolean isChecked(ElementRef element) {
        try {
            return page.locator(element.getLocator()).first().isChecked();
        } catch (TimeoutError e) {
            throw new ActionTimeoutException("Reading state of " + element.getLocator() + " timed out", e);
        }
    }

    @Override
    public String capture(ScreenshotStage stage) {
        String fileName = String.format("run-%s-%s-%s.png", runId,
                stage.name().toLowerCase(Locale.ROOT).replace('_', '-'),
                LocalDateTime.now().format(FILE_TIMESTAMP));
        Path path = Paths.get(config.getScreenshotDir()).resolve(fileName);
        page.screenshot(new Page.ScreenshotOptions().setPath(path).setFullPage(true));
        log.debug("[{}] Screenshot {} saved to {}", runId, stage, path);
        return path.toString();
    }

    /**
     * HTML5 constraint validation first, then the configured success and error indicators.
     */
    @Override
    public SubmissionOutcome readSubmissionOutcome() {
        page.waitForTimeout(config.getSubmitSettleMs());

        Object invalid = page.evaluate(
                "() => document.querySelectorAll('input:invalid, select:invalid, textarea:invalid').length > 0");
        if (Boolean.TRUE.equals(invalid)) {
            return SubmissionOutcome.VALIDATION_ERROR;
        }
        for (String selector : config.getSuccessIndicators()) {
            if (isVisible(selector)) {
                log.debug("[{}] Success indicator matched: {}", runId, selector);
                return SubmissionOutcome.SUCCESS;
            }
        }
        for (String selector : config.getErrorIndicators()) {
            if (isVisible(selector)) {
                log.debug("[{}] Error indicator matched: {}", runId, selector);
                return SubmissionOutcome.VALIDATION_ERROR;
            }
        }
        return SubmissionOutcome.UNKNOWN;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            playwright.close();
        } catch (PlaywrightException e) {
            log.warn("[{}] Closing browser failed: {}", runId, e.getMessage());
        } finally {
            onClose.run();
        }
    }

    private void fill(Locator locator, String text) {
        String expected = text != null ? text : "";
        locator.fill(expected);
        String actual = locator.inputValue();
        if (!expected.equals(actual)) {
            // e.g. maxlength truncation or an input mask
            throw new ValueRejectedException("Field kept '" + actual + "' instead of '" + expected + "'", null);
        }
    }

    private void select(Locator locator, String option) {
        if (option == null || option.isEmpty()) {
            locator.selectOption(new String[0]);
            return;
        }
        requireOption(locator, option);
        locator.selectOption(option);
    }

    private void addOption(Locator locator, String option) {
        requireOption(locator, option);
        locator.evaluate("""
                (el, v) => {
                    for (const o of el.options) {
                        if (o.value === v || o.text === v) o.selected = true;
                    }
                    el.dispatchEvent(new Event('change', { bubbles: true }));
                }
                """, option);
    }

    private void requireOption(Locator locator, String option) {
        Object present = locator.evaluate(
                "(el, v) => Array.from(el.options || []).some(o => o.value === v || o.text === v)", option);
        if (!Boolean.TRUE.equals(present)) {
            throw new ValueRejectedException("Option '" + option + "' is not offered", null);
        }
    }

    private void upload(Locator locator, String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            locator.setInputFiles(new Path[0]);
            return;
        }
        locator.setInputFiles(new FilePayload(fileName, "application/octet-stream",
                ("Test upload " + fileName).getBytes(StandardCharsets.UTF_8)));
    }

    private boolean isVisible(String selector) {
        try {
            Locator locator = page.locator(selector);
            return locator.count() > 0 && locator.first().isVisible();
        } catch (PlaywrightException e) {
            log.debug("[{}] Indicator '{}' not usable: {}", runId, selector, e.getMessage());
            return false;
        }
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }
}
