package com.incident.dedup.quality;

import com.incident.dedup.config.ReferenceData;
import com.incident.dedup.config.ReferenceDataLoader;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Static reliability rank per source. Lookups are case-insensitive; unknown and null
 * sources get the default rank.
 */
public class SourcePriorityTable {

    private final Map<String, Integer> priorities;
    private final int defaultPriority;

    public SourcePriorityTable(Map<String, Integer> priorities, int defaultPriority) {
        Map<String, Integer> normalized = new HashMap<>();
        priorities.forEach((source, priority) -> normalized.put(normalize(source), priority));
        this.priorities = Map.copyOf(normalized);
        this.defaultPriority = defaultPriority;
    }

    public static SourcePriorityTable from(ReferenceData referenceData) {
        return new SourcePriorityTable(referenceData.sourcePriorities(), referenceData.defaultSourcePriority());
    }

    public static SourcePriorityTable defaults() {
        return from(ReferenceDataLoader.loadDefaults());
    }

    public int priority(String source) {
        if (source == null) {
            return defaultPriority;
        }
        return priorities.getOrDefault(normalize(source), defaultPriority);
    }

    public int getDefaultPriority() {
        return defaultPriority;
    }

    private static String normalize(String source) {
        return source.trim().toUpperCase(Locale.ROOT);
    }
}
