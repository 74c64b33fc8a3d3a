package com.titlesearch.pipeline.model;

import java.time.LocalDate;

public record ChainOfTitleEntry(
    long id,
    long searchId,
    Long documentId,
    int sequenceNumber,
    String grantor,
    String grantee,
    LocalDate transferDate,
    String instrumentNumber,
    DocumentType documentType
) {
}
