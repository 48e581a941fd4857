package com.lottoharvest.infrastructure.http;

import com.lottoharvest.domain.exception.FetchException;
import com.lottoharvest.domain.exception.TransportException;
import com.lottoharvest.domain.ports.FetchClient;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.UrlEncodedFormEntity;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.client5.http.protocol.RedirectLocations;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.NameValuePair;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicNameValuePair;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link FetchClient} on Apache HttpClient 5.
 *
 * <p>Each instance owns its connection pool; workers get their own instance. Failed
 * attempts are retried per the {@link RetryPolicy}. When every attempt against the
 * primary host fails with a retryable error and a fallback host is configured, the same
 * request is tried once more against the fallback host.
 */
public class HttpFetchClient implements FetchClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpFetchClient.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private final CloseableHttpClient httpClient;
    private final Settings settings;
    private final RetryPolicy retryPolicy;
    private final ResponseDecoder decoder;
    private final Sleeper sleeper;

    public HttpFetchClient(Settings settings, RetryPolicy retryPolicy) {
        this(settings, retryPolicy, new ResponseDecoder(), Sleeper.THREAD);
    }

    HttpFetchClient(Settings settings, RetryPolicy retryPolicy, ResponseDecoder decoder, Sleeper sleeper) {
        this.settings = settings;
        this.retryPolicy = retryPolicy;
        this.decoder = decoder;
        this.sleeper = sleeper;

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(Timeout.ofMilliseconds(settings.connectTimeout().toMillis()))
                .build())
            .build();
        this.httpClient = HttpClients.custom()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(RequestConfig.custom()
                .setResponseTimeout(Timeout.ofMilliseconds(settings.responseTimeout().toMillis()))
                .build())
            .disableAutomaticRetries()
            .build();
    }

    @Override
    public FetchResponse fetchDocument(String url, Method method, Map<String, String> formParameters)
            throws FetchException {
        try {
            return fetchWithRetry(url, method, formParameters);
        } catch (TransportException primaryFailure) {
            String fallbackUrl = fallbackUrl(url);
            if (fallbackUrl == null || !primaryFailure.isRetryable()) {
                throw primaryFailure;
            }
            logger.warn("Primary host failed for {}, trying fallback {} once", url, fallbackUrl);
            return executeOnce(fallbackUrl, method, formParameters);
        }
    }

    private FetchResponse fetchWithRetry(String url, Method method, Map<String, String> formParameters)
            throws FetchException {
        TransportException last = null;
        for (int attempt = 1; attempt <= retryPolicy.getMaxAttempts(); attempt++) {
            if (attempt > 1) {
                Duration backoff = retryPolicy.backoffFor(attempt - 1);
                logger.warn("Retrying {} (attempt {}/{}) in {} ms: {}",
                    url, attempt, retryPolicy.getMaxAttempts(), backoff.toMillis(), last.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TransportException("Interrupted while backing off", url, ie);
                }
            }
            try {
                return executeOnce(url, method, formParameters);
            } catch (TransportException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                last = e;
            }
        }
        throw last;
    }

    private FetchResponse executeOnce(String url, Method method, Map<String, String> formParameters)
            throws FetchException {
        HttpUriRequestBase request = buildRequest(url, method, formParameters);
        HttpClientContext context = HttpClientContext.create();
        logger.debug("{} {}", method, url);

        RawResponse raw;
        try {
            raw = httpClient.execute(request, context, response -> {
                HttpEntity entity = response.getEntity();
                byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
                String contentType = entity == null ? null : entity.getContentType();
                return new RawResponse(response.getCode(), body, contentType);
            });
        } catch (IOException e) {
            throw new TransportException("Request failed: " + e.getMessage(), url, e);
        }

        if (raw.statusCode() < 200 || raw.statusCode() >= 300) {
            logger.error("HTTP request to {} failed with status {}", url, raw.statusCode());
            logResponseBodyPreview(raw.body());
            throw new TransportException("HTTP request failed with status " + raw.statusCode(), url,
                raw.statusCode(), retryPolicy.isRetryable(raw.statusCode()));
        }

        ResponseDecoder.Decoded decoded = decoder.decode(raw.body(), raw.contentType(), url);
        return new FetchResponse(raw.statusCode(), decoded.text(), finalUrl(url, context), decoded.charset());
    }

    private HttpUriRequestBase buildRequest(String url, Method method, Map<String, String> formParameters) {
        HttpUriRequestBase request;
        if (method == Method.POST) {
            HttpPost post = new HttpPost(url);
            List<NameValuePair> pairs = new ArrayList<>();
            if (formParameters != null) {
                formParameters.forEach((k, v) -> pairs.add(new BasicNameValuePair(k, v)));
            }
            post.setEntity(new UrlEncodedFormEntity(pairs, StandardCharsets.UTF_8));
            request = post;
        } else {
            request = new HttpGet(url);
        }
        if (settings.userAgent() != null) {
            request.addHeader("User-Agent", settings.userAgent());
        }
        if (settings.acceptLanguage() != null) {
            request.addHeader("Accept-Language", settings.acceptLanguage());
        }
        return request;
    }

    String fallbackUrl(String url) {
        String fallbackHost = settings.fallbackHost();
        if (fallbackHost == null || fallbackHost.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url);
            if (fallbackHost.equalsIgnoreCase(uri.getHost())) {
                return null;
            }
            return new URI(uri.getScheme(), uri.getUserInfo(), fallbackHost, uri.getPort(),
                uri.getPath(), uri.getQuery(), uri.getFragment()).toString();
        } catch (URISyntaxException e) {
            logger.debug("Cannot derive fallback URL from {}", url);
            return null;
        }
    }

    private static String finalUrl(String requested, HttpClientContext context) {
        RedirectLocations locations = context.getRedirectLocations();
        if (locations == null || locations.size() == 0) {
            return requested;
        }
        return locations.get(locations.size() - 1).toString();
    }

    private static void logResponseBodyPreview(byte[] body) {
        String text = new String(body, StandardCharsets.UTF_8);
        String preview = text.length() > MAX_LOG_BODY_LENGTH
            ? text.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : text;
        logger.error("Response body preview: {}", preview);
    }

    @Override
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            logger.warn("Error closing HTTP client", e);
        }
    }

    private record RawResponse(int statusCode, byte[] body, String contentType) {}

    /**
     * Connection settings of one client.
     */
    public record Settings(
        Duration connectTimeout,
        Duration responseTimeout,
        String userAgent,
        String acceptLanguage,
        String fallbackHost
    ) {}

    @FunctionalInterface
    interface Sleeper {
        Sleeper THREAD = d -> Thread.sleep(d.toMillis());

        void sleep(Duration duration) throws InterruptedException;
    }
}
