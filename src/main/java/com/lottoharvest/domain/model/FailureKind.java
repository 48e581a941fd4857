package com.lottoharvest.domain.model;

public enum FailureKind {
    TRANSPORT,
    DECODE,
    STRUCTURE_NOT_FOUND,
    GUARD_TRIPPED,
    INTERRUPTED,
    /** A runtime error outside the fetch path, such as a parser bug. */
    UNEXPECTED
}
