package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.model.ChainOfTitleEntry;
import com.titlesearch.pipeline.model.EncumbranceRecord;
import com.titlesearch.pipeline.model.TitleReportSummary;
import com.titlesearch.pipeline.persistence.DocumentRepository;
import com.titlesearch.pipeline.persistence.TitleRecordRepository;
import org.springframework.stereotype.Service;

import java.time.Year;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Scores a search's title risk from its chain of title, active encumbrances and documents flagged
 * for review, and stores the resulting report summary.
 */
@Service
public class TitleReportService {
    private static final int MAX_SCORE = 100;
    private static final long TIME_GAP_DAYS = 365L * 5;

    private final TitleRecordRepository titleRecords;
    private final DocumentRepository documents;

    public TitleReportService(TitleRecordRepository titleRecords, DocumentRepository documents) {
        this.titleRecords = titleRecords;
        this.documents = documents;
    }

    public TitleReportSummary generate(long searchId) {
        List<ChainOfTitleEntry> chain = titleRecords.findChain(searchId);
        List<EncumbranceRecord> encumbrances = titleRecords.findEncumbrances(searchId);
        int needsReview = documents.countNeedingReview(searchId);
        RiskAssessment risk = assess(chain, encumbrances, needsReview);

        String reportNumber = "TR-" + Year.now().getValue() + "-"
            + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase(Locale.ROOT);
        titleRecords.saveReport(searchId, reportNumber, risk.score(), risk.level(), summarize(risk));
        return titleRecords.findReport(searchId);
    }

    public RiskAssessment assess(List<ChainOfTitleEntry> chain, List<EncumbranceRecord> encumbrances, int needsReview) {
        int score = 0;
        List<String> factors = new ArrayList<>();

        for (EncumbranceRecord encumbrance : encumbrances) {
            if (!encumbrance.isActive()) {
                continue;
            }
            switch (encumbrance.encumbranceType()) {
                case TAX_LIEN, JUDGMENT -> {
                    score += 25;
                    factors.add("High-risk lien: " + label(encumbrance));
                }
                case MECHANICS_LIEN, LIS_PENDENS -> {
                    score += 20;
                    factors.add("Active " + label(encumbrance));
                }
                default -> {
                    score += 5;
                    factors.add("Open " + label(encumbrance) + ": "
                        + (encumbrance.holder() == null ? "unknown holder" : encumbrance.holder()));
                }
            }
        }

        if (chain.size() < 2) {
            score += 30;
            factors.add("Incomplete chain of title: fewer than 2 transfers found");
        } else if (chain.size() < 5) {
            score += 10;
            factors.add("Limited chain of title history");
        }

        if (needsReview > 0) {
            score += 5 * needsReview;
            factors.add(needsReview + " document(s) require manual review");
        }

        for (int i = 1; i < chain.size(); i++) {
            ChainOfTitleEntry previous = chain.get(i - 1);
            ChainOfTitleEntry current = chain.get(i);
            Set<String> previousGrantees = names(previous.grantee());
            Set<String> currentGrantors = names(current.grantor());
            if (currentGrantors.isEmpty() || currentGrantors.contains("UNKNOWN")) {
                score += 15;
                factors.add("Unknown grantor on chain entry " + (i + 1));
            } else if (!previousGrantees.isEmpty()
                && previousGrantees.stream().noneMatch(currentGrantors::contains)) {
                score += 15;
                factors.add("Potential gap in chain between entries " + i + " and " + (i + 1));
            }
            if (previous.transferDate() != null && current.transferDate() != null) {
                long days = ChronoUnit.DAYS.between(previous.transferDate(), current.transferDate());
                if (days > TIME_GAP_DAYS) {
                    score += 10;
                    factors.add(String.format(
                        Locale.ROOT,
                        "Large time gap of %.1f years between chain entries %d and %d",
                        days / 365.0,
                        i,
                        i + 1
                    ));
                }
            }
        }

        score = Math.min(score, MAX_SCORE);
        return new RiskAssessment(score, levelFor(score), factors);
    }

    static String levelFor(int score) {
        if (score < 20) {
            return "LOW";
        }
        if (score < 40) {
            return "MODERATE";
        }
        if (score < 60) {
            return "ELEVATED";
        }
        if (score < 80) {
            return "HIGH";
        }
        return "CRITICAL";
    }

    private static String summarize(RiskAssessment risk) {
        String headline = risk.level() + " RISK (" + risk.score() + "/100): " + explanation(risk.level());
        if (risk.factors().isEmpty()) {
            return headline;
        }
        return headline + "\n\nRisk Factors:\n" + risk.factors().stream()
            .map(factor -> "- " + factor)
            .collect(Collectors.joining("\n"));
    }

    private static String explanation(String level) {
        return switch (level) {
            case "LOW" -> "Title appears clear with minimal issues.";
            case "MODERATE" -> "Some issues identified that may require attention before closing.";
            case "ELEVATED" -> "Multiple issues identified. Recommend thorough review before proceeding.";
            case "HIGH" -> "Significant title issues present. May affect insurability.";
            default -> "Critical title defects identified. Title may be uninsurable.";
        };
    }

    private static String label(EncumbranceRecord encumbrance) {
        return encumbrance.encumbranceType().name().replace('_', ' ').toLowerCase(Locale.ROOT);
    }

    private static Set<String> names(String joined) {
        if (joined == null || joined.isBlank()) {
            return Set.of();
        }
        return Arrays.stream(joined.split(";"))
            .map(name -> name.trim().toUpperCase(Locale.ROOT))
            .filter(name -> !name.isEmpty())
            .collect(Collectors.toCollection(HashSet::new));
    }
}
