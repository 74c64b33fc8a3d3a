package com.titlesearch.pipeline.browser;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;

/**
 * One automation session: a browser, its context and a page. Never shared beyond the holder of the
 * {@link BrowserLease} that hands it out.
 */
public interface BrowserSession {
    Page page();

    BrowserContext context();

    /** Closes the context before the browser it belongs to. */
    void close();
}
