package com.team.formtest.service.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.team.formtest.config.BrowserConfig;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens Playwright browser sessions for test runs.
 *
 * A Playwright instance is bound to the thread that created it, so every run gets its
 * own instance and browser, created on the run's worker thread and closed with the session.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PlaywrightService implements BrowserSessionProvider {

    private final BrowserConfig config;
    private final Map<String, PlaywrightBrowserSession> openSessions = new ConcurrentHashMap<>();

    @Override
    public BrowserSession open(String runId) {
        log.info("[{}] Starting Playwright (headless={})", runId, config.isHeadless());
        Playwright playwright = Playwright.create();
        try {
            BrowserType.LaunchOptions launchOptions = new BrowserType.LaunchOptions()
                    .setHeadless(config.isHeadless())
                    .setTimeout(30000);

            // System Chromium inside Docker
            if (config.getChromiumPath() != null && !config.getChromiumPath().isBlank()) {
                launchOptions.setExecutablePath(Paths.get(config.getChromiumPath()));
                log.debug("[{}] Using system Chromium: {}", runId, config.getChromiumPath());
            }

            Browser browser = playwright.chromium().launch(launchOptions);
            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                    .setViewportSize(1280, 720));
            Page page = context.newPage();
            page.setDefaultTimeout(config.getActionTimeoutMs());

            PlaywrightBrowserSession session = new PlaywrightBrowserSession(runId, playwright, page, config,
                    () -> openSessions.remove(runId));
            openSessions.put(runId, session);
            return session;
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }

    /**
     * Close sessions still open at shutdown, e.g. of runs abandoned after a hard timeout.
     */
    @PreDestroy
    public void cleanup() {
        openSessions.values().forEach(PlaywrightBrowserSession::close);
        openSessions.clear();
        log.info("Playwright resources cleaned up");
    }
}
