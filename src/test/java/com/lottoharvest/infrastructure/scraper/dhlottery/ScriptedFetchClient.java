package com.lottoharvest.infrastructure.scraper.dhlottery;

import com.lottoharvest.domain.exception.FetchException;
import com.lottoharvest.domain.ports.FetchClient;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FetchClient answering canned bodies or failures per URL, recording every request.
 */
class ScriptedFetchClient implements FetchClient {

    private final Map<String, String> bodies = new HashMap<>();
    private final Map<String, FetchException> failures = new HashMap<>();
    final List<String> requestedUrls = new ArrayList<>();
    final List<Map<String, String>> forms = new ArrayList<>();
    boolean closed;

    ScriptedFetchClient answer(String url, String body) {
        bodies.put(url, body);
        return this;
    }

    ScriptedFetchClient fail(String url, FetchException failure) {
        failures.put(url, failure);
        return this;
    }

    @Override
    public FetchResponse fetchDocument(String url, Method method, Map<String, String> formParameters)
            throws FetchException {
        requestedUrls.add(url);
        forms.add(formParameters);
        FetchException failure = failures.get(url);
        if (failure != null) {
            throw failure;
        }
        String body = bodies.get(url);
        if (body == null) {
            throw new IllegalStateException("No scripted answer for " + url);
        }
        return new FetchResponse(200, body, url, "UTF-8");
    }

    @Override
    public void close() {
        closed = true;
    }
}
