package com.lottoharvest.domain.ports;

import com.lottoharvest.domain.exception.FetchException;

import java.io.Closeable;
import java.util.Map;

/**
 * Port for retrieving documents from the source site.
 */
public interface FetchClient extends Closeable {

    enum Method { GET, POST }

    /**
     * Fetches a document and decodes its body to text.
     *
     * @param url            absolute URL
     * @param method         GET or POST
     * @param formParameters form fields sent url-encoded with POST; ignored for GET
     * @return status code and decoded text of the final response
     * @throws com.lottoharvest.domain.exception.TransportException on network failure, timeout or non-2xx status
     * @throws com.lottoharvest.domain.exception.DecodeException when the body cannot be decoded
     */
    FetchResponse fetchDocument(String url, Method method, Map<String, String> formParameters) throws FetchException;

    default FetchResponse get(String url) throws FetchException {
        return fetchDocument(url, Method.GET, Map.of());
    }

    @Override
    default void close() {
    }

    record FetchResponse(int statusCode, String text, String finalUrl, String charset) {}
}
