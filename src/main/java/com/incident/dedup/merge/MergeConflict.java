package com.incident.dedup.merge;

/**
 * A field the planner refused to change because both records disagree on an established value.
 *
 * @param field          the field name
 * @param primaryValue   the value kept on the primary
 * @param secondaryValue the secondary's differing value
 */
public record MergeConflict(String field, String primaryValue, String secondaryValue) {
}
