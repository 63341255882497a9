package com.incident.dedup.similarity;

import com.incident.dedup.config.ReferenceDataLoader;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Curated groups of incident-type names that describe the same category of event.
 */
public class IncidentTypeSynonyms {

    private final List<Set<String>> groups;

    public IncidentTypeSynonyms(List<List<String>> groups) {
        List<Set<String>> normalized = new ArrayList<>();
        for (List<String> group : groups) {
            normalized.add(group.stream()
                    .map(IncidentTypeSynonyms::normalize)
                    .collect(Collectors.toUnmodifiableSet()));
        }
        this.groups = List.copyOf(normalized);
    }

    /**
     * Synonym groups from the bundled reference data.
     */
    public static IncidentTypeSynonyms defaults() {
        return new IncidentTypeSynonyms(ReferenceDataLoader.loadDefaults().incidentTypeSynonymGroups());
    }

    /**
     * True if both names belong to one group. Names are compared uppercased and trimmed.
     */
    public boolean sameGroup(String type1, String type2) {
        String normalized1 = normalize(type1);
        String normalized2 = normalize(type2);
        for (Set<String> group : groups) {
            if (group.contains(normalized1) && group.contains(normalized2)) {
                return true;
            }
        }
        return false;
    }

    public List<Set<String>> getGroups() {
        return groups;
    }

    static String normalize(String type) {
        return type == null ? "" : type.trim().toUpperCase(Locale.ROOT);
    }
}
