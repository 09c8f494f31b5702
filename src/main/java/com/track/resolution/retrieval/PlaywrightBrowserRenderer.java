package com.track.resolution.retrieval;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;

/**
 * Headless Chromium rendering through Playwright.
 * Each render gets its own Playwright instance and browser context; Playwright objects are
 * not shared between threads.
 */
public class PlaywrightBrowserRenderer implements BrowserRenderer {
    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserRenderer.class);

    private static final String TRACK_LINK_SELECTOR = "a[href*='/track/']";

    private final boolean headless;
    private final String userAgent;
    private volatile Boolean available;

    public PlaywrightBrowserRenderer() {
        this(true, HttpPageClient.DEFAULT_USER_AGENT);
    }

    public PlaywrightBrowserRenderer(boolean headless, String userAgent) {
        this.headless = headless;
        this.userAgent = userAgent;
    }

    @Override
    public boolean isAvailable() {
        Boolean result = available;
        if (result == null) {
            synchronized (this) {
                if (available == null) {
                    available = probe();
                }
                result = available;
            }
        }
        return result;
    }

    private boolean probe() {
        try (Playwright playwright = Playwright.create();
             Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(true))) {
            log.info("Browser automation available (Chromium {})", browser.version());
            return true;
        } catch (RuntimeException e) {
            log.warn("Browser automation unavailable, continuing without it: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public String render(URI uri, Duration timeout) throws RetrievalException {
        try (Playwright playwright = Playwright.create();
             Browser browser = playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
             BrowserContext context = browser.newContext(new Browser.NewContextOptions().setUserAgent(userAgent))) {
            Page page = context.newPage();
            page.navigate(uri.toString(), new Page.NavigateOptions().setTimeout(timeout.toMillis()));
            try {
                page.waitForSelector(TRACK_LINK_SELECTOR,
                        new Page.WaitForSelectorOptions().setTimeout(timeout.toMillis() / 2.0));
            } catch (TimeoutError e) {
                log.debug("No track links rendered on {} within {}", uri, timeout);
            }
            return page.content();
        } catch (PlaywrightException e) {
            throw new RetrievalException("Browser rendering failed for " + uri + ": " + e.getMessage(), e);
        }
    }
}
