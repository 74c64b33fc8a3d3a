package com.titlesearch.pipeline.util;

import com.titlesearch.pipeline.model.DocumentType;

import java.util.Locale;

/**
 * Keyword mapping from free-text recorder document descriptions to {@link DocumentType}. More
 * specific phrases are checked before the generic ones they contain.
 */
public final class DocumentTypeClassifier {

    private DocumentTypeClassifier() {
    }

    public static DocumentType classify(String description) {
        if (description == null || description.isBlank()) {
            return DocumentType.OTHER;
        }
        String lower = description.toLowerCase(Locale.ROOT);
        if (lower.contains("warranty deed") || lower.equals("wd")) {
            return DocumentType.WARRANTY_DEED;
        }
        if (lower.contains("quitclaim") || lower.contains("quit claim") || lower.equals("qcd")) {
            return DocumentType.QUITCLAIM_DEED;
        }
        if (lower.contains("deed of trust") || lower.equals("dot")) {
            return DocumentType.DEED_OF_TRUST;
        }
        if (lower.contains("mortgage")) {
            return DocumentType.MORTGAGE;
        }
        if (lower.contains("satisfaction")) {
            return DocumentType.SATISFACTION;
        }
        if (lower.contains("release") || lower.contains("reconveyance")) {
            return DocumentType.RELEASE;
        }
        if (lower.contains("tax lien") || lower.contains("federal tax") || lower.contains("internal revenue")) {
            return DocumentType.TAX_LIEN;
        }
        if (lower.contains("mechanic")) {
            return DocumentType.MECHANICS_LIEN;
        }
        if (lower.contains("lien")) {
            return DocumentType.LIEN;
        }
        if (lower.contains("judgment") || lower.contains("judgement")) {
            return DocumentType.JUDGMENT;
        }
        if (lower.contains("lis pendens")) {
            return DocumentType.LIS_PENDENS;
        }
        if (lower.contains("easement") || lower.contains("right of way")) {
            return DocumentType.EASEMENT;
        }
        if (lower.contains("plat") || lower.contains("survey")) {
            return DocumentType.PLAT;
        }
        if (lower.contains("deed")) {
            return DocumentType.DEED;
        }
        return DocumentType.OTHER;
    }
}
