package com.lottoharvest.domain.exception;

/**
 * The page was readable but the expected table or marker was not on it.
 */
public class StructureNotFoundException extends RuntimeException {

    public StructureNotFoundException(String message) {
        super(message);
    }
}
