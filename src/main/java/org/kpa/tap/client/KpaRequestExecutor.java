package org.kpa.tap.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.kpa.tap.configuration.KpaProperties;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CancellationException;

/**
 * Issues a single KPA API call, classifies the response and applies the retry policy.
 * <p>
 * Retriable outcomes (5xx, configured extra statuses, network failures and the
 * {@code rate_limit_exceeded} envelope) are retried with exponential backoff until
 * {@code kpa.retry.max-attempts} is reached. A rate-limit response additionally forces
 * the configured cooldown before the retry is scheduled. Fatal outcomes are thrown
 * immediately.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KpaRequestExecutor {

    static final String RATE_LIMIT_ERROR = "rate_limit_exceeded";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final RestClient restClient;
    private final KpaProperties properties;
    private final ObjectMapper objectMapper;
    private final RetrySleeper sleeper;

    public Map<String, Object> post(String path, Map<String, Object> payload) {
        return execute(HttpMethod.POST, path, payload).payload();
    }

    public ClassifiedResponse execute(HttpMethod method, String path, Map<String, Object> payload) {
        String url = resolveUrl(path);
        Map<String, Object> body = withToken(payload);
        int maxAttempts = properties.getRetry().getMaxAttempts();

        ApiException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Request to " + url + " cancelled before attempt " + attempt);
            }
            try {
                ClassifiedResponse response = send(method, url, body);
                switch (response.classification()) {
                    case SUCCESS -> {
                        return response;
                    }
                    case FATAL -> throw new FatalApiException(response);
                    case RETRIABLE -> {
                        if (isRateLimited(response)) {
                            Duration cooldown = properties.getRetry().getRateLimitCooldown();
                            log.info("Rate limit exceeded, sleeping for {} seconds...", cooldown.toSeconds());
                            pause(cooldown, url);
                        }
                        lastFailure = new RetriableApiException(response);
                    }
                }
            } catch (ResourceAccessException exception) {
                lastFailure = new RetriableApiException("Request to " + url + " failed: " + exception.getMessage(), url, exception);
            }

            if (attempt == maxAttempts) {
                break;
            }
            Duration delay = backoffDelay(attempt);
            log.warn("Backing off {} ms before attempt {}/{} for {}: {}",
                    delay.toMillis(), attempt + 1, maxAttempts, url, lastFailure.getMessage());
            pause(delay, url);
        }
        log.error("Giving up on {} after {} attempts", url, maxAttempts);
        throw lastFailure;
    }

    public ClassifiedResponse classify(int statusCode, String body, String url) {
        Map<String, Object> payload;
        boolean malformed = false;
        try {
            payload = parseBody(body);
        } catch (JsonProcessingException exception) {
            log.warn("Response from {} is not valid JSON: {}", url, exception.getOriginalMessage());
            payload = Map.of();
            malformed = true;
        }

        ResponseClassification classification;
        if (statusCode == 200 && RATE_LIMIT_ERROR.equals(payload.get("error"))) {
            classification = ResponseClassification.RETRIABLE;
        } else if (properties.getRetry().getExtraRetryStatuses().contains(statusCode)
                || (statusCode >= 500 && statusCode < 600)) {
            classification = ResponseClassification.RETRIABLE;
        } else if ((statusCode >= 400 && statusCode < 500)
                || (statusCode == 200 && Boolean.FALSE.equals(payload.get("ok")))
                || malformed) {
            classification = ResponseClassification.FATAL;
        } else {
            classification = ResponseClassification.SUCCESS;
        }
        return new ClassifiedResponse(classification, statusCode, body, url, payload);
    }

    Duration backoffDelay(int attempt) {
        return properties.getRetry().getBackoffFactor().multipliedBy(1L << (attempt - 1));
    }

    private ClassifiedResponse send(HttpMethod method, String url, Map<String, Object> body) {
        return restClient.method(method)
                .uri(url)
                .body(body)
                .exchange((request, response) -> classify(
                        response.getStatusCode().value(),
                        StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8),
                        url));
    }

    private boolean isRateLimited(ClassifiedResponse response) {
        return response.statusCode() == 200 && RATE_LIMIT_ERROR.equals(response.payload().get("error"));
    }

    private void pause(Duration duration, String url) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException exception) {
            Thread.currentThread().interrupt();
            CancellationException cancellation = new CancellationException("Retry loop for " + url + " was interrupted");
            cancellation.initCause(exception);
            throw cancellation;
        }
    }

    private Map<String, Object> parseBody(String body) throws JsonProcessingException {
        if (!StringUtils.hasText(body)) {
            return Map.of();
        }
        Map<String, Object> parsed = objectMapper.readValue(body, MAP_TYPE);
        return parsed == null ? Map.of() : parsed;
    }

    private Map<String, Object> withToken(Map<String, Object> payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("token", properties.getAccessToken());
        if (payload != null) {
            body.putAll(payload);
        }
        return body;
    }

    private String resolveUrl(String path) {
        String base = properties.getBaseUrl();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return path.startsWith("/") ? base + path : base + "/" + path;
    }
}
