package com.titlesearch.pipeline.adapter;

import com.titlesearch.pipeline.browser.BrowserSession;
import com.titlesearch.pipeline.model.DownloadedDocument;
import com.titlesearch.pipeline.model.SearchResult;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Uniform contract for county recorder and court record sites. Implementations drive the page of
 * the session they are given and never keep it beyond the call.
 */
public interface RecorderAdapter {

    String siteKey();

    /** Opens the site and clears any landing disclaimers. False when the site cannot be used. */
    boolean initialize(BrowserSession session);

    List<SearchResult> searchByName(BrowserSession session, String name, DateRange dateRange);

    List<SearchResult> searchByParcel(BrowserSession session, String parcelNumber, DateRange dateRange);

    List<SearchResult> searchByInstrument(BrowserSession session, String instrumentNumber, DateRange dateRange);

    default List<SearchResult> searchByAddress(BrowserSession session, String streetAddress, DateRange dateRange) {
        return List.of();
    }

    /** Returns null when the site offers nothing to download for {@code result}. */
    DownloadedDocument downloadDocument(BrowserSession session, SearchResult result, Path directory) throws IOException;

    boolean checkHealth();
}
