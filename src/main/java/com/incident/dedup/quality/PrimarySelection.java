package com.incident.dedup.quality;

import com.incident.dedup.core.model.RawRecord;

/**
 * Outcome of primary selection for a matched pair.
 *
 * @param primary        the record that survives and absorbs data
 * @param secondary      the record that is marked merged-away
 * @param primaryScore   quality score of the primary
 * @param secondaryScore quality score of the secondary
 */
public record PrimarySelection(RawRecord primary, RawRecord secondary,
                               double primaryScore, double secondaryScore) {
}
