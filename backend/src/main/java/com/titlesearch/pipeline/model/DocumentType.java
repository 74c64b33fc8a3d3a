package com.titlesearch.pipeline.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum DocumentType {
    WARRANTY_DEED,
    QUITCLAIM_DEED,
    DEED,
    DEED_OF_TRUST,
    MORTGAGE,
    RELEASE,
    SATISFACTION,
    TAX_LIEN,
    MECHANICS_LIEN,
    LIEN,
    JUDGMENT,
    LIS_PENDENS,
    EASEMENT,
    PLAT,
    COURT_CASE,
    OTHER;

    private static final Set<DocumentType> CONVEYANCES = EnumSet.of(WARRANTY_DEED, QUITCLAIM_DEED, DEED);
    private static final Set<DocumentType> ENCUMBRANCES = EnumSet.of(
        DEED_OF_TRUST, MORTGAGE, TAX_LIEN, MECHANICS_LIEN, LIEN, JUDGMENT, LIS_PENDENS
    );

    public boolean isConveyance() {
        return CONVEYANCES.contains(this);
    }

    public boolean isEncumbrance() {
        return ENCUMBRANCES.contains(this);
    }

    public static DocumentType parse(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        try {
            return DocumentType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
