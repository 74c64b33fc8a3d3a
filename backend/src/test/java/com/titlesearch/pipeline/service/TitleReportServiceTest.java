package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.model.ChainOfTitleEntry;
import com.titlesearch.pipeline.model.DocumentType;
import com.titlesearch.pipeline.model.EncumbranceRecord;
import com.titlesearch.pipeline.model.EncumbranceType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TitleReportServiceTest {
    private final TitleReportService service = new TitleReportService(null, null);

    @Test
    void cleanLongChainIsLowRisk() {
        RiskAssessment risk = service.assess(continuousChain(5), List.of(), 0);

        assertThat(risk.score()).isZero();
        assertThat(risk.level()).isEqualTo("LOW");
        assertThat(risk.factors()).isEmpty();
    }

    @Test
    void encumbrancesAreWeightedByType() {
        List<EncumbranceRecord> encumbrances = List.of(
            encumbrance(EncumbranceType.TAX_LIEN, EncumbranceRecord.ACTIVE),
            encumbrance(EncumbranceType.MECHANICS_LIEN, EncumbranceRecord.ACTIVE),
            encumbrance(EncumbranceType.DEED_OF_TRUST, EncumbranceRecord.ACTIVE),
            encumbrance(EncumbranceType.JUDGMENT, EncumbranceRecord.RELEASED)
        );

        RiskAssessment risk = service.assess(continuousChain(5), encumbrances, 0);

        assertThat(risk.score()).isEqualTo(25 + 20 + 5);
        assertThat(risk.level()).isEqualTo("ELEVATED");
    }

    @Test
    void shortChainAndReviewDocumentsAddRisk() {
        RiskAssessment single = service.assess(continuousChain(1), List.of(), 2);
        RiskAssessment short3 = service.assess(continuousChain(3), List.of(), 0);

        assertThat(single.score()).isEqualTo(30 + 10);
        assertThat(single.level()).isEqualTo("ELEVATED");
        assertThat(short3.score()).isEqualTo(10);
        assertThat(short3.level()).isEqualTo("LOW");
    }

    @Test
    void gapBetweenGranteeAndNextGrantorIsPenalized() {
        List<ChainOfTitleEntry> chain = new ArrayList<>(continuousChain(5));
        chain.set(3, entry(4, "STRANGER LLC", "OWNER 4"));

        RiskAssessment risk = service.assess(chain, List.of(), 0);

        assertThat(risk.score()).isEqualTo(15);
        assertThat(risk.factors()).anyMatch(factor -> factor.contains("between entries 3 and 4"));
    }

    @Test
    void transfersMoreThanFiveYearsApartAreFlagged() {
        List<ChainOfTitleEntry> chain = new ArrayList<>(continuousChain(5));
        chain.set(4, entry(5, "OWNER 4", "OWNER 5", LocalDate.of(2010, 1, 15)));
        chain.set(3, entry(4, "OWNER 3", "OWNER 4", LocalDate.of(1999, 1, 15)));

        RiskAssessment risk = service.assess(chain, List.of(), 0);

        assertThat(risk.score()).isEqualTo(10 + 10);
        assertThat(risk.factors()).containsExactly(
            "Large time gap of 5.6 years between chain entries 3 and 4",
            "Large time gap of 11.0 years between chain entries 4 and 5"
        );
    }

    @Test
    void fiveYearsToTheDayIsNotAGap() {
        List<ChainOfTitleEntry> chain = new ArrayList<>(continuousChain(5));
        chain.set(1, entry(2, "OWNER 1", "OWNER 2", LocalDate.of(1991, 6, 1).plusDays(365L * 5)));
        chain.set(2, entry(3, "OWNER 2", "OWNER 3", LocalDate.of(1991, 6, 1).plusDays(365L * 5 + 1)));
        chain.set(3, entry(4, "OWNER 3", "OWNER 4", LocalDate.of(1991, 6, 1).plusDays(365L * 5 + 2)));
        chain.set(4, entry(5, "OWNER 4", "OWNER 5", LocalDate.of(1991, 6, 1).plusDays(365L * 5 + 3)));

        assertThat(service.assess(chain, List.of(), 0).score()).isZero();
    }

    @Test
    void unknownOrBlankGrantorIsAChainBreak() {
        List<ChainOfTitleEntry> chain = new ArrayList<>(continuousChain(5));
        chain.set(2, entry(3, "  ", "OWNER 3"));
        chain.set(4, entry(5, "Unknown", "OWNER 5"));

        RiskAssessment risk = service.assess(chain, List.of(), 0);

        assertThat(risk.score()).isEqualTo(15 + 15);
        assertThat(risk.factors()).containsExactly(
            "Unknown grantor on chain entry 3",
            "Unknown grantor on chain entry 5"
        );
    }

    @Test
    void scoreIsCappedAtOneHundred() {
        List<EncumbranceRecord> encumbrances = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            encumbrances.add(encumbrance(EncumbranceType.JUDGMENT, EncumbranceRecord.ACTIVE));
        }

        RiskAssessment risk = service.assess(List.of(), encumbrances, 0);

        assertThat(risk.score()).isEqualTo(100);
        assertThat(risk.level()).isEqualTo("CRITICAL");
    }

    @Test
    void levelBoundaries() {
        assertThat(TitleReportService.levelFor(19)).isEqualTo("LOW");
        assertThat(TitleReportService.levelFor(20)).isEqualTo("MODERATE");
        assertThat(TitleReportService.levelFor(40)).isEqualTo("ELEVATED");
        assertThat(TitleReportService.levelFor(60)).isEqualTo("HIGH");
        assertThat(TitleReportService.levelFor(80)).isEqualTo("CRITICAL");
    }

    private static List<ChainOfTitleEntry> continuousChain(int size) {
        List<ChainOfTitleEntry> chain = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            chain.add(entry(i, "OWNER " + (i - 1), "OWNER " + i));
        }
        return chain;
    }

    private static ChainOfTitleEntry entry(int sequence, String grantor, String grantee) {
        return entry(sequence, grantor, grantee, LocalDate.of(1990 + sequence, 6, 1));
    }

    private static ChainOfTitleEntry entry(int sequence, String grantor, String grantee, LocalDate transferDate) {
        return new ChainOfTitleEntry(
            0L, 1L, null, sequence, grantor, grantee,
            transferDate, "INST-" + sequence, DocumentType.WARRANTY_DEED
        );
    }

    private static EncumbranceRecord encumbrance(EncumbranceType type, String status) {
        return new EncumbranceRecord(0L, 1L, null, type, status, "FIRST BANK", LocalDate.of(2015, 3, 2), "lien");
    }
}
