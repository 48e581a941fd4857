package com.lottoharvest.domain.exception;

/**
 * The body arrived but could not be turned into text. Never retried.
 */
public class DecodeException extends FetchException {

    public DecodeException(String message, String url) {
        super(message, url);
    }

    public DecodeException(String message, String url, Throwable cause) {
        super(message, url, cause);
    }
}
