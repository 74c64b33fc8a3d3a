package com.titlesearch.pipeline.adapter;

import com.microsoft.playwright.APIResponse;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.LoadState;
import com.microsoft.playwright.options.WaitUntilState;
import com.titlesearch.pipeline.browser.BrowserSession;
import com.titlesearch.pipeline.model.DownloadedDocument;
import com.titlesearch.pipeline.model.SearchResult;
import com.titlesearch.pipeline.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Adapter for recorder sites without a dedicated implementation: finds the search input by common
 * name/id/placeholder keywords, submits the form and parses whatever result table comes back.
 */
public class GenericRecorderAdapter implements RecorderAdapter {
    private static final Logger log = LoggerFactory.getLogger(GenericRecorderAdapter.class);
    private static final DateTimeFormatter FORM_DATE = DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.US);
    private static final Duration HEALTH_TIMEOUT = Duration.ofSeconds(10);

    private static final List<String> DISCLAIMER_SELECTORS = List.of(
        "button:has-text('Accept')",
        "button:has-text('I Agree')",
        "button:has-text('Continue')",
        "input[type='submit'][value*='Accept']",
        "input[type='submit'][value*='Agree']",
        "a:has-text('Accept')",
        "#accept",
        "#agree"
    );
    private static final List<String> SUBMIT_SELECTORS = List.of(
        "button[type='submit']",
        "input[type='submit']",
        "button:has-text('Search')",
        "button:has-text('Find')",
        "input[value*='Search' i]",
        "#search",
        ".search-button"
    );
    private static final List<String> NAME_KEYWORDS = List.of("name", "party", "grantor", "grantee", "owner");
    private static final List<String> PARCEL_KEYWORDS = List.of("parcel", "apn", "pin", "schedule", "account");
    private static final List<String> INSTRUMENT_KEYWORDS = List.of("instrument", "reception", "document", "docnum");
    private static final List<String> ADDRESS_KEYWORDS = List.of("address", "street", "situs", "location");

    private final SiteConfig config;
    private final HttpClient healthClient;

    public GenericRecorderAdapter(SiteConfig config) {
        this.config = config;
        this.healthClient = HttpClient.newBuilder()
            .connectTimeout(HEALTH_TIMEOUT)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    }

    @Override
    public String siteKey() {
        return config.siteKey();
    }

    @Override
    public boolean initialize(BrowserSession session) {
        if (config.baseUrl() == null || config.baseUrl().isBlank()) {
            log.warn("No URL configured for {}", config.siteName());
            return false;
        }
        Page page = session.page();
        try {
            page.navigate(config.baseUrl(), new Page.NavigateOptions().setWaitUntil(WaitUntilState.NETWORKIDLE));
            acceptDisclaimers(page);
            log.info("Generic adapter initialized for {}", config.siteName());
            return true;
        } catch (PlaywrightException e) {
            log.warn("Failed to initialize generic adapter for {}: {}", config.siteName(), e.getMessage());
            return false;
        }
    }

    @Override
    public List<SearchResult> searchByName(BrowserSession session, String name, DateRange dateRange) {
        return search(session, NAME_KEYWORDS, name, dateRange);
    }

    @Override
    public List<SearchResult> searchByParcel(BrowserSession session, String parcelNumber, DateRange dateRange) {
        return search(session, PARCEL_KEYWORDS, parcelNumber, dateRange);
    }

    @Override
    public List<SearchResult> searchByInstrument(BrowserSession session, String instrumentNumber, DateRange dateRange) {
        return search(session, INSTRUMENT_KEYWORDS, instrumentNumber, dateRange);
    }

    @Override
    public List<SearchResult> searchByAddress(BrowserSession session, String streetAddress, DateRange dateRange) {
        return search(session, ADDRESS_KEYWORDS, streetAddress, dateRange);
    }

    @Override
    public DownloadedDocument downloadDocument(BrowserSession session, SearchResult result, Path directory) throws IOException {
        if (result.downloadUrl() == null || result.downloadUrl().isBlank()) {
            log.warn("No download URL for instrument {}", result.instrumentNumber());
            return null;
        }
        pace(session.page());
        APIResponse response = session.context().request().get(result.downloadUrl());
        try {
            if (!response.ok()) {
                log.warn("Download of instrument {} returned HTTP {}", result.instrumentNumber(), response.status());
                return null;
            }
            byte[] body = response.body();
            Files.createDirectories(directory);
            Path target = directory.resolve(safeFileName(result.instrumentNumber()) + ".pdf");
            Files.write(target, body);
            return new DownloadedDocument(target.toString(), body.length, HashUtils.sha256Hex(body));
        } finally {
            response.dispose();
        }
    }

    @Override
    public boolean checkHealth() {
        if (config.baseUrl() == null || config.baseUrl().isBlank()) {
            return false;
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(config.baseUrl()))
            .timeout(HEALTH_TIMEOUT)
            .GET()
            .build();
        try {
            HttpResponse<Void> response = healthClient.send(request, HttpResponse.BodyHandlers.discarding());
            return response.statusCode() < 500;
        } catch (IOException e) {
            log.debug("Health check failed for {}: {}", config.siteName(), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private List<SearchResult> search(BrowserSession session, List<String> keywords, String query, DateRange dateRange) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        Page page = session.page();
        Locator input = findInput(page, keywords);
        if (input == null) {
            log.info("No search input matching {} on {}", keywords, config.siteName());
            return List.of();
        }
        input.fill(query.trim());
        if (dateRange != null) {
            trySetDate(page, dateRange.start(), "from", "start", "begin");
            trySetDate(page, dateRange.end(), "to", "end", "through");
        }
        submit(page);
        waitForResults(page);
        List<SearchResult> results = RecorderResultParser.parse(page.content(), page.url());
        log.info("Search for '{}' on {} returned {} results", query, config.siteName(), results.size());
        pace(page);
        return results;
    }

    private Locator findInput(Page page, List<String> keywords) {
        for (String keyword : keywords) {
            List<String> selectors = List.of(
                "input[name*='" + keyword + "' i]",
                "input[id*='" + keyword + "' i]",
                "input[placeholder*='" + keyword + "' i]",
                "input[aria-label*='" + keyword + "' i]"
            );
            for (String selector : selectors) {
                Locator candidate = page.locator(selector);
                if (candidate.count() > 0) {
                    return candidate.first();
                }
            }
        }
        return null;
    }

    private void trySetDate(Page page, LocalDate date, String... keywords) {
        if (date == null) {
            return;
        }
        for (String keyword : keywords) {
            Locator field = findInput(page, List.of(keyword + "date", "date" + keyword));
            if (field != null) {
                field.fill(date.format(FORM_DATE));
                return;
            }
        }
    }

    private void acceptDisclaimers(Page page) {
        for (String selector : DISCLAIMER_SELECTORS) {
            Locator button = page.locator(selector);
            if (button.count() > 0) {
                button.first().click();
                log.debug("Accepted disclaimer on {} with {}", config.siteName(), selector);
                return;
            }
        }
    }

    private void submit(Page page) {
        for (String selector : SUBMIT_SELECTORS) {
            Locator button = page.locator(selector);
            if (button.count() > 0) {
                button.first().click();
                return;
            }
        }
        page.keyboard().press("Enter");
    }

    private void waitForResults(Page page) {
        try {
            page.waitForLoadState(LoadState.NETWORKIDLE);
        } catch (TimeoutError e) {
            // long-polling pages never go idle; parse what is there
            log.debug("Network idle wait timed out on {}", config.siteName());
        }
    }

    private void pace(Page page) {
        if (config.delayBetweenRequestsMs() > 0) {
            page.waitForTimeout(config.delayBetweenRequestsMs());
        }
    }

    private static String safeFileName(String instrumentNumber) {
        String cleaned = instrumentNumber == null ? "" : instrumentNumber.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isBlank() ? "document" : cleaned;
    }
}
