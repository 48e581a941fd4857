package com.lottoharvest.domain.exception;

/**
 * The latest round could not be determined. Fatal for a run.
 */
public class RoundResolutionException extends RuntimeException {

    public RoundResolutionException(String message) {
        super(message);
    }

    public RoundResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
