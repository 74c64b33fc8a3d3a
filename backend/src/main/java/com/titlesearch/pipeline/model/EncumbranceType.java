package com.titlesearch.pipeline.model;

public enum EncumbranceType {
    MORTGAGE,
    DEED_OF_TRUST,
    TAX_LIEN,
    MECHANICS_LIEN,
    JUDGMENT,
    LIS_PENDENS,
    OTHER_LIEN;

    public static EncumbranceType fromDocumentType(DocumentType type) {
        return switch (type) {
            case MORTGAGE -> MORTGAGE;
            case DEED_OF_TRUST -> DEED_OF_TRUST;
            case TAX_LIEN -> TAX_LIEN;
            case MECHANICS_LIEN -> MECHANICS_LIEN;
            case JUDGMENT, COURT_CASE -> JUDGMENT;
            case LIS_PENDENS -> LIS_PENDENS;
            default -> OTHER_LIEN;
        };
    }
}
