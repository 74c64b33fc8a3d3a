package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.model.ChainOfTitleEntry;
import com.titlesearch.pipeline.model.DocumentRecord;
import com.titlesearch.pipeline.model.DocumentSource;
import com.titlesearch.pipeline.model.DocumentType;
import com.titlesearch.pipeline.model.EncumbranceRecord;
import com.titlesearch.pipeline.model.EncumbranceType;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BuildChainStageTest {

    @Test
    void chainContainsOnlyConveyancesInOrder() {
        List<DocumentRecord> records = List.of(
            record(1, DocumentType.WARRANTY_DEED, DocumentSource.COUNTY_RECORDER, "2001-1", "SMITH JOHN", "DOE JANE", null),
            record(2, DocumentType.DEED_OF_TRUST, DocumentSource.COUNTY_RECORDER, "2001-2", "DOE JANE", "FIRST BANK", null),
            record(3, DocumentType.QUITCLAIM_DEED, DocumentSource.COUNTY_RECORDER, "2010-7", "DOE JANE", "DOE JANE; DOE JOHN", null)
        );

        List<ChainOfTitleEntry> chain = BuildChainStage.buildChain(9L, records);

        assertThat(chain).extracting(ChainOfTitleEntry::instrumentNumber).containsExactly("2001-1", "2010-7");
        assertThat(chain).extracting(ChainOfTitleEntry::sequenceNumber).containsExactly(1, 2);
        assertThat(chain.get(1).grantee()).isEqualTo("DOE JANE; DOE JOHN");
    }

    @Test
    void releaseReferencingInstrumentClearsEncumbrance() {
        List<DocumentRecord> records = List.of(
            record(1, DocumentType.DEED_OF_TRUST, DocumentSource.COUNTY_RECORDER, "2001-2", "DOE JANE", "FIRST BANK", null),
            record(2, DocumentType.MECHANICS_LIEN, DocumentSource.COUNTY_RECORDER, "2018-44", "ACME ROOFING", "DOE JANE", null),
            record(3, DocumentType.RELEASE, DocumentSource.COUNTY_RECORDER, "2012-9", "FIRST BANK", "DOE JANE",
                "Release of deed of trust recorded as instrument 2001-2")
        );

        List<EncumbranceRecord> encumbrances = BuildChainStage.detectEncumbrances(9L, records);

        assertThat(encumbrances).hasSize(2);
        assertThat(encumbrances.get(0).encumbranceType()).isEqualTo(EncumbranceType.DEED_OF_TRUST);
        assertThat(encumbrances.get(0).status()).isEqualTo(EncumbranceRecord.RELEASED);
        assertThat(encumbrances.get(0).holder()).isEqualTo("FIRST BANK");
        assertThat(encumbrances.get(1).encumbranceType()).isEqualTo(EncumbranceType.MECHANICS_LIEN);
        assertThat(encumbrances.get(1).isActive()).isTrue();
    }

    @Test
    void courtJudgmentHolderIsThePlaintiff() {
        List<DocumentRecord> records = List.of(
            record(1, DocumentType.JUDGMENT, DocumentSource.COURT_RECORDS, "2022CV3101", "CAPITAL ONE; OTHER", "DOE JANE", null),
            record(2, DocumentType.COURT_CASE, DocumentSource.COURT_RECORDS, "2015CV0042", "ACME", "DOE JANE", null)
        );

        List<EncumbranceRecord> encumbrances = BuildChainStage.detectEncumbrances(9L, records);

        assertThat(encumbrances).hasSize(1);
        assertThat(encumbrances.get(0).encumbranceType()).isEqualTo(EncumbranceType.JUDGMENT);
        assertThat(encumbrances.get(0).holder()).isEqualTo("CAPITAL ONE");
    }

    private static DocumentRecord record(
        long id,
        DocumentType type,
        DocumentSource source,
        String instrument,
        String grantor,
        String grantee,
        String summary
    ) {
        return new DocumentRecord(
            id, 9L, type, source, instrument, null, LocalDate.of(2000, 1, 1).plusDays(id), grantor, grantee,
            null, null, null, null, summary, false, null
        );
    }
}
