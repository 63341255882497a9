package com.incident.dedup.scoring;

import com.incident.dedup.core.model.IncidentFacts;
import com.incident.dedup.core.model.ScoreRejection;
import com.incident.dedup.core.model.SimilarityScore;
import com.incident.dedup.geo.GeoTimeMetrics;
import com.incident.dedup.similarity.ImoSimilarity;
import com.incident.dedup.similarity.IncidentTypeSimilarity;
import com.incident.dedup.similarity.VesselNameSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted similarity of two incident reports over time, space, vessel identity and incident type.
 *
 * <p>Pairs missing a date or valid coordinates, or falling outside the profile's time or
 * distance window, are short-circuited to a zero score carrying a {@link ScoreRejection};
 * identity components are not computed for them. Scoring never throws on bad input.</p>
 */
public class CompositeScorer {
    private static final Logger log = LoggerFactory.getLogger(CompositeScorer.class);

    /**
     * Vessel component when neither report names a vessel.
     */
    public static final double NO_VESSEL_DEFAULT = 0.7;

    private final ScoringProfile profile;
    private final VesselNameSimilarity vesselNameSimilarity;
    private final ImoSimilarity imoSimilarity;
    private final IncidentTypeSimilarity incidentTypeSimilarity;

    public CompositeScorer(ScoringProfile profile) {
        this(profile, new VesselNameSimilarity(), new ImoSimilarity(), new IncidentTypeSimilarity());
    }

    public CompositeScorer(ScoringProfile profile,
                           VesselNameSimilarity vesselNameSimilarity,
                           ImoSimilarity imoSimilarity,
                           IncidentTypeSimilarity incidentTypeSimilarity) {
        this.profile = profile;
        this.vesselNameSimilarity = vesselNameSimilarity;
        this.imoSimilarity = imoSimilarity;
        this.incidentTypeSimilarity = incidentTypeSimilarity;
    }

    public SimilarityScore score(IncidentFacts r1, IncidentFacts r2) {
        if (r1.getOccurredAt() == null || r2.getOccurredAt() == null) {
            return reject(r1, r2, ScoreRejection.MISSING_DATE, Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY);
        }
        double hours = GeoTimeMetrics.timeDeltaHours(r1.getOccurredAt(), r2.getOccurredAt());
        if (!GeoTimeMetrics.isValidCoordinate(r1.getLatitude(), r1.getLongitude())
                || !GeoTimeMetrics.isValidCoordinate(r2.getLatitude(), r2.getLongitude())) {
            return reject(r1, r2, ScoreRejection.INVALID_COORDINATES, Double.POSITIVE_INFINITY, hours);
        }
        double km = GeoTimeMetrics.distanceKm(r1.getLatitude(), r1.getLongitude(),
                r2.getLatitude(), r2.getLongitude());

        double time = GeoTimeMetrics.timeProximity(r1.getOccurredAt(), r2.getOccurredAt(), profile.maxHours());
        if (time == 0.0) {
            return reject(r1, r2, ScoreRejection.TIME_OUT_OF_WINDOW, km, hours);
        }
        double spatial = GeoTimeMetrics.spatialProximity(r1.getLatitude(), r1.getLongitude(),
                r2.getLatitude(), r2.getLongitude(), profile.maxKm());
        if (spatial == 0.0) {
            return reject(r1, r2, ScoreRejection.DISTANCE_OUT_OF_WINDOW, km, hours);
        }

        double imo = imoSimilarity.compare(r1.getVesselImo(), r2.getVesselImo());
        double name = vesselNameSimilarity.compute(r1.getVesselName(), r2.getVesselName());
        double vessel = vesselComponent(imo, name, isBlank(r1.getVesselName()) && isBlank(r2.getVesselName()));
        double type = incidentTypeSimilarity.compute(r1.getIncidentTypeName(), r2.getIncidentTypeName());

        double total = clamp(profile.weights().combine(time, spatial, vessel, type));
        SimilarityScore score = new SimilarityScore(total, time, spatial, vessel, name, imo, type, km, hours, null);
        log.debug("pair.scored left={} right={} {}", r1.getId(), r2.getId(), score);
        return score;
    }

    public ScoringProfile getProfile() {
        return profile;
    }

    static double vesselComponent(double imo, double name, boolean bothLackName) {
        if (imo == 1.0) {
            return 1.0;
        }
        return bothLackName ? NO_VESSEL_DEFAULT : name;
    }

    private SimilarityScore reject(IncidentFacts r1, IncidentFacts r2, ScoreRejection rejection,
                                   double km, double hours) {
        log.debug("pair.rejected left={} right={} reason={}", r1.getId(), r2.getId(), rejection);
        return SimilarityScore.rejected(rejection, km, hours);
    }

    // Guards rounding drift above 1.0 from floating-point weight sums.
    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
