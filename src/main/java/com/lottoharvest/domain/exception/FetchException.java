package com.lottoharvest.domain.exception;

import java.io.IOException;

/**
 * Base failure of fetching one document from the source.
 */
public class FetchException extends IOException {

    private final String url;

    public FetchException(String message, String url) {
        super(message);
        this.url = url;
    }

    public FetchException(String message, String url, Throwable cause) {
        super(message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
