package com.incident.dedup.quality;

import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.geo.GeoTimeMetrics;

/**
 * Additive point score over weighted field presence.
 * Used only to rank two records against each other; every populated field adds points.
 */
public class CompletenessScorer {

    static final int LONG_DESCRIPTION_LENGTH = 100;

    public int completeness(RawRecord record) {
        int score = 0;

        if (present(record.getTitle())) score += 1;

        if (present(record.getDescription())) {
            score += record.getDescription().length() > LONG_DESCRIPTION_LENGTH ? 3 : 1;
        }

        if (GeoTimeMetrics.isValidCoordinate(record.getLatitude(), record.getLongitude())) score += 2;
        if (record.getOccurredAt() != null) score += 1;
        if (present(record.getRegion())) score += 1;
        if (present(record.getLocation())) score += 1;

        if (present(record.getVesselName())) score += 1;
        if (present(record.getVesselType())) score += 1;
        if (present(record.getVesselFlag())) score += 1;
        if (present(record.getVesselImo())) score += 2;
        if (present(record.getVesselStatus())) score += 1;

        if (present(record.getIncidentTypeName())) score += 1;
        if (present(record.getReferenceId())) score += 1;
        if (present(record.getUpdateText())) score += 2;
        if (present(record.getRawPayload())) score += 1;

        return score;
    }

    private static boolean present(String value) {
        return value != null && !value.isBlank();
    }
}
