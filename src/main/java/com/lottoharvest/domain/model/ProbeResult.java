package com.lottoharvest.domain.model;

/**
 * Outcome of a single existence check against one round index.
 */
public enum ProbeResult {
    EXISTS,
    ABSENT,
    /** Transport or decode failure; says nothing about the round. */
    UNKNOWN
}
