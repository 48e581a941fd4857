package com.lottoharvest.domain.model;

/**
 * A unit of work (round, section or page) that did not complete normally.
 */
public record FailureRecord(String unitId, FailureKind kind, String reason) {
}
