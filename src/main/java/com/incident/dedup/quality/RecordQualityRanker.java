package com.incident.dedup.quality;

import com.incident.dedup.core.model.RawRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses which of two matched records survives as primary.
 * Quality is {@code 0.7 * completeness + 0.3 * sourcePriority}; ties go to the first argument.
 */
public class RecordQualityRanker {
    private static final Logger log = LoggerFactory.getLogger(RecordQualityRanker.class);

    static final double COMPLETENESS_WEIGHT = 0.7;
    static final double PRIORITY_WEIGHT = 0.3;

    private final CompletenessScorer completenessScorer;
    private final SourcePriorityTable sourcePriorities;

    public RecordQualityRanker() {
        this(new CompletenessScorer(), SourcePriorityTable.defaults());
    }

    public RecordQualityRanker(CompletenessScorer completenessScorer, SourcePriorityTable sourcePriorities) {
        this.completenessScorer = completenessScorer;
        this.sourcePriorities = sourcePriorities;
    }

    public double quality(RawRecord record) {
        return COMPLETENESS_WEIGHT * completenessScorer.completeness(record)
                + PRIORITY_WEIGHT * sourcePriorities.priority(record.getSource());
    }

    public PrimarySelection determinePrimary(RawRecord r1, RawRecord r2) {
        double score1 = quality(r1);
        double score2 = quality(r2);
        PrimarySelection selection = score1 >= score2
                ? new PrimarySelection(r1, r2, score1, score2)
                : new PrimarySelection(r2, r1, score2, score1);
        log.debug("primary.selected primary={} primaryScore={} secondary={} secondaryScore={}",
                selection.primary().getId(), selection.primaryScore(),
                selection.secondary().getId(), selection.secondaryScore());
        return selection;
    }

    public CompletenessScorer getCompletenessScorer() {
        return completenessScorer;
    }

    public SourcePriorityTable getSourcePriorities() {
        return sourcePriorities;
    }
}
