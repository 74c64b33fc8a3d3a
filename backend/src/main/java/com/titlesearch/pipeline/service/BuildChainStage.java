package com.titlesearch.pipeline.service;

import com.titlesearch.pipeline.model.ChainOfTitleEntry;
import com.titlesearch.pipeline.model.DocumentRecord;
import com.titlesearch.pipeline.model.DocumentSource;
import com.titlesearch.pipeline.model.DocumentType;
import com.titlesearch.pipeline.model.EncumbranceRecord;
import com.titlesearch.pipeline.model.EncumbranceType;
import com.titlesearch.pipeline.model.PipelineStep;
import com.titlesearch.pipeline.model.SearchJob;
import com.titlesearch.pipeline.model.StageOutcome;
import com.titlesearch.pipeline.persistence.DocumentRepository;
import com.titlesearch.pipeline.persistence.TitleRecordRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Derives the chain of title from conveyances in recording order and one encumbrance per lien-type
 * document. An encumbrance is released when a later release or satisfaction references its
 * instrument number.
 */
@Component
public class BuildChainStage implements PipelineStage {
    private final DocumentRepository documents;
    private final TitleRecordRepository titleRecords;

    public BuildChainStage(DocumentRepository documents, TitleRecordRepository titleRecords) {
        this.documents = documents;
        this.titleRecords = titleRecords;
    }

    @Override
    public PipelineStep step() {
        return PipelineStep.BUILD_CHAIN;
    }

    @Override
    public StageOutcome execute(SearchJob job) {
        List<DocumentRecord> records = documents.findBySearch(job.id());
        List<ChainOfTitleEntry> chain = buildChain(job.id(), records);
        List<EncumbranceRecord> encumbrances = detectEncumbrances(job.id(), records);
        titleRecords.replaceChain(job.id(), chain);
        titleRecords.replaceEncumbrances(job.id(), encumbrances);
        long active = encumbrances.stream().filter(EncumbranceRecord::isActive).count();
        return StageOutcome.success(
            records.size(),
            chain.size(),
            0,
            "Chain of title has " + chain.size() + " transfers and " + active + " active encumbrances"
        );
    }

    static List<ChainOfTitleEntry> buildChain(long searchId, List<DocumentRecord> records) {
        List<ChainOfTitleEntry> chain = new ArrayList<>();
        int sequence = 1;
        for (DocumentRecord record : records) {
            if (!record.documentType().isConveyance()) {
                continue;
            }
            chain.add(new ChainOfTitleEntry(
                0L,
                searchId,
                record.id(),
                sequence++,
                record.grantor(),
                record.grantee(),
                record.recordingDate(),
                record.instrumentNumber(),
                record.documentType()
            ));
        }
        return chain;
    }

    static List<EncumbranceRecord> detectEncumbrances(long searchId, List<DocumentRecord> records) {
        List<DocumentRecord> releases = records.stream()
            .filter(record -> record.documentType() == DocumentType.RELEASE
                || record.documentType() == DocumentType.SATISFACTION)
            .toList();
        List<EncumbranceRecord> encumbrances = new ArrayList<>();
        for (DocumentRecord record : records) {
            if (!record.documentType().isEncumbrance()) {
                continue;
            }
            boolean released = isReleased(record, releases);
            encumbrances.add(new EncumbranceRecord(
                0L,
                searchId,
                record.id(),
                EncumbranceType.fromDocumentType(record.documentType()),
                released ? EncumbranceRecord.RELEASED : EncumbranceRecord.ACTIVE,
                holderOf(record),
                record.recordingDate(),
                describe(record)
            ));
        }
        return encumbrances;
    }

    private static boolean isReleased(DocumentRecord encumbrance, List<DocumentRecord> releases) {
        String instrument = encumbrance.instrumentNumber();
        if (instrument == null || instrument.isBlank()) {
            return false;
        }
        for (DocumentRecord release : releases) {
            String summary = release.analysisSummary();
            if (summary != null && summary.contains(instrument)) {
                return true;
            }
        }
        return false;
    }

    // Lenders are grantees on recorded instruments; a court case names the plaintiff first.
    private static String holderOf(DocumentRecord record) {
        String parties = record.source() == DocumentSource.COURT_RECORDS ? record.grantor() : record.grantee();
        if (parties == null || parties.isBlank()) {
            return null;
        }
        return parties.split(";")[0].trim();
    }

    private static String describe(DocumentRecord record) {
        StringBuilder out = new StringBuilder(record.documentType().name().replace('_', ' ').toLowerCase(Locale.ROOT));
        if (record.instrumentNumber() != null) {
            out.append(" ").append(record.instrumentNumber());
        }
        if (record.recordingDate() != null) {
            out.append(" recorded ").append(record.recordingDate());
        }
        return out.toString();
    }
}
