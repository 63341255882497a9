package com.incident.dedup.matching;

import com.incident.dedup.audit.AuditAction;
import com.incident.dedup.audit.AuditService;
import com.incident.dedup.core.model.CanonicalIncident;
import com.incident.dedup.core.model.MatchState;
import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.core.model.SimilarityScore;
import com.incident.dedup.geo.BoundingBox;
import com.incident.dedup.geo.GeoTimeMetrics;
import com.incident.dedup.geo.TimeWindow;
import com.incident.dedup.logging.LogContext;
import com.incident.dedup.metrics.MetricsService;
import com.incident.dedup.metrics.NoOpMetricsService;
import com.incident.dedup.scoring.CompositeScorer;
import com.incident.dedup.scoring.ScoringProfile;
import com.incident.dedup.similarity.ImoSimilarity;
import com.incident.dedup.similarity.VesselNameSimilarity;
import com.incident.dedup.store.IncidentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Matches a newly ingested record against existing canonical incidents.
 *
 * <p>Progresses {@code NO_CANDIDATE -> SEARCHING -> MATCHED | NO_MATCH}. Records without a
 * date or valid coordinates end in {@code NO_MATCH} without touching the store. A candidate
 * qualifies when its composite score reaches the threshold or an override rule forces a
 * match, and no rule vetoes it. The qualifying candidate with the highest score wins; equal
 * scores resolve to the lowest incident id. Only store failures propagate as exceptions.</p>
 */
public class CandidateFinder {
    private static final Logger log = LoggerFactory.getLogger(CandidateFinder.class);

    static final String ACTOR = "candidate-finder";

    private final IncidentStore store;
    private final MatchOptions options;
    private final CompositeScorer scorer;
    private final OverrideRules overrideRules;
    private final KeywordSignatures keywordSignatures;
    private final VesselNameSimilarity vesselNameSimilarity;
    private final ImoSimilarity imoSimilarity;
    private final MetricsService metricsService;
    private final AuditService auditService;

    public CandidateFinder(IncidentStore store) {
        this(store, MatchOptions.defaults(), OverrideRules.defaults(), KeywordSignatures.defaults(),
                new NoOpMetricsService(), new AuditService());
    }

    public CandidateFinder(IncidentStore store, MatchOptions options, OverrideRules overrideRules,
                           KeywordSignatures keywordSignatures, MetricsService metricsService,
                           AuditService auditService) {
        this(store, options,
                new CompositeScorer(ScoringProfile.ingest()
                        .withWindows(options.getWindowHours(), options.getMaxDistanceKm())),
                overrideRules, keywordSignatures, new VesselNameSimilarity(), new ImoSimilarity(),
                metricsService, auditService);
    }

    public CandidateFinder(IncidentStore store, MatchOptions options, CompositeScorer scorer,
                           OverrideRules overrideRules, KeywordSignatures keywordSignatures,
                           VesselNameSimilarity vesselNameSimilarity, ImoSimilarity imoSimilarity,
                           MetricsService metricsService, AuditService auditService) {
        this.store = store;
        this.options = options;
        this.scorer = scorer;
        this.overrideRules = overrideRules;
        this.keywordSignatures = keywordSignatures;
        this.vesselNameSimilarity = vesselNameSimilarity;
        this.imoSimilarity = imoSimilarity;
        this.metricsService = metricsService;
        this.auditService = auditService;
    }

    /**
     * Finds the canonical incident the record describes, if any.
     *
     * @throws com.incident.dedup.store.StoreException if the candidate query fails
     */
    public MatchOutcome findMatch(RawRecord record) {
        try (LogContext ctx = LogContext.forMatch(LogContext.generateCorrelationId(), record.getId())) {
            MatchOutcome outcome = search(record);
            metricsService.incrementCandidateOutcome(outcome.state());
            if (outcome.isMatched()) {
                log.info("match.found recordId={} canonicalId={} score={} override={}",
                        record.getId(), outcome.canonicalIncidentId(), outcome.score().total(),
                        outcome.override().rule());
                auditService.record(AuditAction.MATCH_FOUND, record.getId(), ACTOR, Map.of(
                        "canonicalIncidentId", outcome.canonicalIncidentId(),
                        "score", outcome.score().total(),
                        "reason", outcome.reason()));
            } else {
                log.info("match.none recordId={} candidates={} reason={}",
                        record.getId(), outcome.candidatesEvaluated(), outcome.reason());
            }
            return outcome;
        }
    }

    private MatchOutcome search(RawRecord record) {
        MatchState state = MatchState.NO_CANDIDATE;
        if (record.getOccurredAt() == null) {
            return MatchOutcome.noMatch("Missing date", 0);
        }
        if (!GeoTimeMetrics.isValidCoordinate(record.getLatitude(), record.getLongitude())) {
            return MatchOutcome.noMatch("Missing or invalid coordinates", 0);
        }

        state = MatchState.SEARCHING;
        TimeWindow window = TimeWindow.around(record.getOccurredAt(), options.getWindowHours());
        BoundingBox box = BoundingBox.around(record.getLatitude(), record.getLongitude(), options.getMaxDistanceKm());
        List<CanonicalIncident> candidates = store.queryCandidates(window, box);
        log.debug("match.searching recordId={} state={} candidates={}", record.getId(), state, candidates.size());

        CanonicalIncident best = null;
        SimilarityScore bestScore = null;
        OverrideOutcome bestOverride = null;
        for (CanonicalIncident candidate : candidates) {
            SimilarityScore score = scorer.score(record, candidate);
            if (score.isRejected()) {
                continue;
            }
            OverrideOutcome override = overrideRules.evaluate(signals(record, candidate, score));
            if (!qualifies(score, override)) {
                continue;
            }
            if (best == null || isBetter(candidate, score, best, bestScore)) {
                best = candidate;
                bestScore = score;
                bestOverride = override;
            }
        }

        if (best == null) {
            return MatchOutcome.noMatch("No candidate met the threshold or an override rule", candidates.size());
        }
        String reason = bestOverride.isForcedMatch()
                ? bestOverride.reason()
                : "Composite score " + String.format("%.3f", bestScore.total()) + " met threshold";
        return MatchOutcome.matched(best.getId(), bestScore, bestOverride, reason, candidates.size());
    }

    MatchSignals signals(RawRecord record, CanonicalIncident candidate, SimilarityScore score) {
        return new MatchSignals(score.time(), score.spatial(),
                vesselSignal(record, candidate),
                score.incidentType(),
                keywordSignatures.shared(reportText(record.getTitle(), record.getDescription()),
                        reportText(candidate.getTitle(), candidate.getDescription())));
    }

    private double vesselSignal(RawRecord record, CanonicalIncident candidate) {
        if (imoSimilarity.compare(record.getVesselImo(), candidate.getVesselImo()) == 1.0) {
            return 1.0;
        }
        if (!record.hasVesselName()) {
            return 0.0;
        }
        String candidateName = candidate.getVesselName();
        if (candidateName == null || candidateName.isBlank()) {
            // Many feeds only carry the vessel name inside the incident title.
            candidateName = candidate.getTitle();
        }
        return vesselNameSimilarity.compute(record.getVesselName(), candidateName);
    }

    private boolean qualifies(SimilarityScore score, OverrideOutcome override) {
        if (override.isForcedNonMatch()) {
            return false;
        }
        return override.isForcedMatch() || score.total() >= options.getMatchThreshold();
    }

    private static boolean isBetter(CanonicalIncident candidate, SimilarityScore score,
                                    CanonicalIncident best, SimilarityScore bestScore) {
        int byScore = Double.compare(score.total(), bestScore.total());
        if (byScore != 0) {
            return byScore > 0;
        }
        return candidate.getId().compareTo(best.getId()) < 0;
    }

    private static String reportText(String title, String description) {
        if (title == null) {
            return description;
        }
        return description == null ? title : title + "\n" + description;
    }

    public MatchOptions getOptions() {
        return options;
    }
}
