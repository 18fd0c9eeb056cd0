package dev.reviewgate.infrastructure.kantata;

import dev.reviewgate.config.KantataProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Kantata (Mavenlink API v1) client with circuit breaker and rate limiting.
 * Uses WebClient with .block() and a per-call timeout; every failure surfaces as {@link KantataApiException}.
 */
@Component
public class KantataApiClient {
    private static final Logger log = LoggerFactory.getLogger(KantataApiClient.class);
    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};
    private static final String SUBJECT_TYPE = "workspace";

    private final WebClient webClient;
    private final Duration timeout;

    public KantataApiClient(WebClient.Builder builder, KantataProperties properties) {
        this.timeout = properties.requestTimeout();
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(timeout)
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000);
        this.webClient = builder.baseUrl(properties.baseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.apiToken())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @CircuitBreaker(name = "kantata-api") @RateLimiter(name = "kantata-api")
    public KantataProjectStatus fetchProjectStatus(String projectId) {
        Map<String, Object> body = call("fetch workspace " + projectId, webClient.get()
                .uri("/workspaces/{id}", projectId)
                .retrieve()
                .bodyToMono(JSON_OBJECT));

        Map<String, Object> workspace = asMap(asMap(body.get("workspaces"), "workspaces").get(projectId),
                "workspaces." + projectId);
        Map<String, Object> status = asMap(workspace.get("status"), "workspace status");
        Object message = status.get("message");
        if (message == null) {
            throw KantataApiException.malformed("workspace " + projectId + " has no status message");
        }
        Object key = status.get("key");
        return new KantataProjectStatus(projectId, (String) workspace.get("title"),
                key instanceof Number ? ((Number) key).intValue() : null, message.toString());
    }

    @CircuitBreaker(name = "kantata-api") @RateLimiter(name = "kantata-api")
    public void updateProjectStatusKey(String projectId, int statusKey) {
        call("update workspace status " + projectId, webClient.put()
                .uri("/workspaces/{id}", projectId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("workspace", Map.of("status_key", statusKey)))
                .retrieve()
                .toBodilessEntity());
        log.info("Kantata workspace {} status key set to {}", projectId, statusKey);
    }

    /**
     * Looks up the value of {@code fieldId} on a workspace. A 404 or an empty result set both mean
     * "no value yet" and return empty; any other failure is thrown.
     */
    @CircuitBreaker(name = "kantata-api") @RateLimiter(name = "kantata-api")
    public Optional<CustomFieldValue> findCustomFieldValue(String projectId, String fieldId) {
        Map<String, Object> body;
        try {
            body = call("find custom field value " + fieldId + " on " + projectId, webClient.get()
                    .uri(uri -> uri.path("/custom_field_values")
                            .queryParam("custom_field_id", fieldId)
                            .queryParam("subject_id", projectId)
                            .queryParam("subject_type", SUBJECT_TYPE)
                            .build())
                    .retrieve()
                    .bodyToMono(JSON_OBJECT));
        } catch (KantataApiException e) {
            if (e.getStatusCode() == 404) return Optional.empty();
            throw e;
        }
        return firstResultId(body).map(id -> new CustomFieldValue(id, valueOf(body, id)));
    }

    @CircuitBreaker(name = "kantata-api") @RateLimiter(name = "kantata-api")
    public String createCustomFieldValue(String projectId, String fieldId, String value) {
        Map<String, Object> payload = Map.of("custom_field_value", Map.of(
                "custom_field_id", fieldId,
                "subject_id", projectId,
                "subject_type", SUBJECT_TYPE,
                "value", value));
        Map<String, Object> body = call("create custom field value on " + projectId, webClient.post()
                .uri("/custom_field_values")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .bodyToMono(JSON_OBJECT));
        String id = firstResultId(body)
                .orElseThrow(() -> KantataApiException.malformed("create response has no result id"));
        log.info("Created Kantata custom field value {} on workspace {}: {}", id, projectId, value);
        return id;
    }

    @CircuitBreaker(name = "kantata-api") @RateLimiter(name = "kantata-api")
    public void updateCustomFieldValue(String valueId, String value) {
        call("update custom field value " + valueId, webClient.put()
                .uri("/custom_field_values/{id}", valueId)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("custom_field_value", Map.of("value", value)))
                .retrieve()
                .toBodilessEntity());
        log.info("Updated Kantata custom field value {}: {}", valueId, value);
    }

    // ── Internal ───────────────────────────────────────────────────

    private <T> T call(String what, Mono<T> request) {
        try {
            T result = request.timeout(timeout).block();
            if (result == null) {
                throw KantataApiException.malformed("empty response to " + what);
            }
            return result;
        } catch (WebClientResponseException e) {
            throw new KantataApiException("Kantata returned %d for %s".formatted(e.getStatusCode().value(), what),
                    e.getStatusCode().value(), e);
        } catch (KantataApiException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new KantataApiException("Kantata call failed for %s: %s".formatted(what, e.getMessage()), 0, e);
        }
    }

    private static Optional<String> firstResultId(Map<String, Object> body) {
        Object results = body.get("results");
        if (results == null) return Optional.empty();
        if (!(results instanceof List)) throw KantataApiException.malformed("results is not a list");
        List<?> list = (List<?>) results;
        if (list.isEmpty()) return Optional.empty();
        Object id = asMap(list.get(0), "results[0]").get("id");
        if (id == null) throw KantataApiException.malformed("results[0] has no id");
        return Optional.of(id.toString());
    }

    private static String valueOf(Map<String, Object> body, String id) {
        Object values = body.get("custom_field_values");
        if (!(values instanceof Map)) return null;
        Object entry = ((Map<?, ?>) values).get(id);
        if (!(entry instanceof Map)) return null;
        Object value = ((Map<?, ?>) entry).get("value");
        return value == null ? null : value.toString();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object node, String path) {
        if (!(node instanceof Map)) {
            throw KantataApiException.malformed(path + " missing or not an object");
        }
        return (Map<String, Object>) node;
    }
}
