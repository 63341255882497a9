package com.incident.dedup.merge;

import com.incident.dedup.core.model.RawRecord;
import com.incident.dedup.geo.GeoTimeMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Plans the field-level merge of a secondary record into a primary.
 *
 * <p>The plan only touches the primary. Established primary values are never overwritten:
 * scalar fields are filled only when empty, descriptions and updates are appended under a
 * source-labelled delimiter, and coordinates are copied as a pair only when the primary's
 * are invalid. Planning a merge for a secondary already folded into the primary returns an
 * empty update, which makes retried merges idempotent.</p>
 */
public class MergePlanner {
    private static final Logger log = LoggerFactory.getLogger(MergePlanner.class);

    private final Clock clock;

    public MergePlanner() {
        this(Clock.systemUTC());
    }

    public MergePlanner(Clock clock) {
        this.clock = clock;
    }

    public FieldUpdateSet planMerge(RawRecord primary, RawRecord secondary) {
        Objects.requireNonNull(primary, "primary is required");
        Objects.requireNonNull(secondary, "secondary is required");
        if (primary.getId().equals(secondary.getId())) {
            throw new IllegalArgumentException("Cannot merge a record with itself: " + primary.getId());
        }
        if (primary.getMergedRecordIds().contains(secondary.getId())) {
            log.debug("merge.alreadyApplied primary={} secondary={}", primary.getId(), secondary.getId());
            return FieldUpdateSet.empty();
        }

        FieldUpdateSet.Builder update = FieldUpdateSet.builder();
        String source = secondary.getSource();

        planDescription(primary, secondary, source, update);
        planUpdateText(primary, secondary, source, update);

        fillIfEmpty(primary, secondary, RawRecord::getTitle, update::title);
        fillIfEmpty(primary, secondary, RawRecord::getLocation, update::location);
        fillIfEmpty(primary, secondary, RawRecord::getRegion, update::region);
        fillIfEmpty(primary, secondary, RawRecord::getIncidentTypeName, update::incidentTypeName);
        fillIfEmpty(primary, secondary, RawRecord::getVesselName, update::vesselName);
        fillIfEmpty(primary, secondary, RawRecord::getVesselType, update::vesselType);
        fillIfEmpty(primary, secondary, RawRecord::getVesselFlag, update::vesselFlag);
        fillIfEmpty(primary, secondary, RawRecord::getVesselImo, update::vesselImo);
        fillIfEmpty(primary, secondary, RawRecord::getVesselStatus, update::vesselStatus);

        if (!GeoTimeMetrics.isValidCoordinate(primary.getLatitude(), primary.getLongitude())
                && GeoTimeMetrics.isValidCoordinate(secondary.getLatitude(), secondary.getLongitude())) {
            update.coordinates(secondary.getLatitude(), secondary.getLongitude());
        }

        planCanonicalLink(primary, secondary, update);

        Instant now = clock.instant();
        Set<String> sources = new LinkedHashSet<>(primary.getMergedSources());
        sources.add(primary.getSource());
        sources.add(source);
        Set<String> recordIds = new LinkedHashSet<>(primary.getMergedRecordIds());
        recordIds.add(secondary.getId());

        update.markMerged(true)
                .lastMergedAt(now)
                .modifiedAt(now)
                .mergedSources(sources)
                .mergedRecordIds(recordIds)
                .processingNotes(appendNote(primary.getProcessingNotes(),
                        "Merged with complementary data from " + source
                                + " (" + secondary.getId() + ") at " + now));

        FieldUpdateSet plan = update.build();
        log.debug("merge.planned primary={} secondary={} fields={}",
                primary.getId(), secondary.getId(), plan.changedFields());
        return plan;
    }

    private void planDescription(RawRecord primary, RawRecord secondary, String source,
                                 FieldUpdateSet.Builder update) {
        String incoming = secondary.getDescription();
        if (isEmpty(incoming)) {
            return;
        }
        String existing = primary.getDescription();
        if (isEmpty(existing)) {
            update.description(incoming);
        } else if (!existing.contains(incoming)) {
            update.description(existing + "\n\nAdditional information from " + source + ":\n" + incoming);
        }
    }

    private void planUpdateText(RawRecord primary, RawRecord secondary, String source,
                                FieldUpdateSet.Builder update) {
        String incoming = secondary.getUpdateText();
        if (isEmpty(incoming)) {
            return;
        }
        String section = "Update from " + source + ":\n" + incoming;
        String existing = primary.getUpdateText();
        update.updateText(isEmpty(existing) ? section : existing + "\n\n" + section);
    }

    private void planCanonicalLink(RawRecord primary, RawRecord secondary, FieldUpdateSet.Builder update) {
        String primaryLink = primary.getCanonicalIncidentId();
        String secondaryLink = secondary.getCanonicalIncidentId();
        if (isEmpty(secondaryLink)) {
            return;
        }
        if (isEmpty(primaryLink)) {
            update.canonicalIncidentId(secondaryLink);
        } else if (!primaryLink.equals(secondaryLink)) {
            log.warn("merge.canonicalLinkConflict primary={} primaryCanonical={} secondary={} secondaryCanonical={}",
                    primary.getId(), primaryLink, secondary.getId(), secondaryLink);
            update.conflict(new MergeConflict("canonicalIncidentId", primaryLink, secondaryLink));
        }
    }

    private static void fillIfEmpty(RawRecord primary, RawRecord secondary,
                                    Function<RawRecord, String> field, Consumer<String> setter) {
        String incoming = field.apply(secondary);
        if (isEmpty(field.apply(primary)) && !isEmpty(incoming)) {
            setter.accept(incoming);
        }
    }

    private static String appendNote(String existing, String note) {
        return isEmpty(existing) ? note : existing + "\n" + note;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isBlank();
    }
}
