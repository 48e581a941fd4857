package com.lottoharvest.domain.model;

import java.util.List;

/**
 * Result of walking every page of one section.
 */
public record SectionHarvest(
    Section section,
    List<StructuredRecord> records,
    StopReason stopReason,
    int pagesFetched,
    List<FailureRecord> failures
) {

    public SectionHarvest {
        records = List.copyOf(records);
        failures = List.copyOf(failures);
    }

    public boolean isFailed() {
        return !failures.isEmpty() && records.isEmpty();
    }
}
