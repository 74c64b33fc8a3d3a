package com.titlesearch.pipeline.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * One row returned by a recorder or court search. {@code attributes} carries site-specific extras
 * such as a court case status.
 */
public record SearchResult(
    String instrumentNumber,
    DocumentType documentType,
    LocalDate recordingDate,
    List<String> grantor,
    List<String> grantee,
    String downloadUrl,
    String bookPage,
    Map<String, String> attributes
) {
    public SearchResult {
        grantor = grantor == null ? List.of() : List.copyOf(grantor);
        grantee = grantee == null ? List.of() : List.copyOf(grantee);
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }
}
