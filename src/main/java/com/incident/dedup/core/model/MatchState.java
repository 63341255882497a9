package com.incident.dedup.core.model;

/**
 * States of single-record candidate matching.
 * {@link #MATCHED} and {@link #NO_MATCH} are terminal.
 */
public enum MatchState {
    NO_CANDIDATE,
    SEARCHING,
    MATCHED,
    NO_MATCH;

    public boolean isTerminal() {
        return this == MATCHED || this == NO_MATCH;
    }
}
