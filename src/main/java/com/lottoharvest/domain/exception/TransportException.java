package com.lottoharvest.domain.exception;

/**
 * Network failure, timeout or non-2xx status. Carries the status code when the
 * server answered at all.
 */
public class TransportException extends FetchException {

    private final Integer statusCode;
    private final boolean retryable;

    public TransportException(String message, String url, Integer statusCode, boolean retryable) {
        super(message, url);
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public TransportException(String message, String url, Throwable cause) {
        super(message, url, cause);
        this.statusCode = null;
        this.retryable = true;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
