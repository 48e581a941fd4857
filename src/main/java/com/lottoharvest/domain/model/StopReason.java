package com.lottoharvest.domain.model;

/**
 * Why a section harvest stopped walking pages.
 */
public enum StopReason {
    /** No table for the tier on the page. */
    NOT_FOUND(false),
    /** The table was found but held no data rows. */
    EMPTY_PAGE(false),
    /** Every row on the page had been seen on an earlier page. */
    REPEATED_PAGE(false),
    /** The tier lists all its rows on one page. */
    SINGLE_PAGE(false),
    RECORD_CEILING(true),
    MAX_PAGES(true),
    BUDGET_EXHAUSTED(true),
    FETCH_FAILED(false),
    /** The worker thread was interrupted between page fetches. */
    INTERRUPTED(false);

    private final boolean guardTripped;

    StopReason(boolean guardTripped) {
        this.guardTripped = guardTripped;
    }

    /** True when a safety ceiling ended the walk rather than the data running out. */
    public boolean isGuardTripped() {
        return guardTripped;
    }
}
