package com.healthsentinel.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthsentinel.core.collect.MetricSource;
import com.healthsentinel.core.collect.RawReadings;
import com.healthsentinel.core.collect.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link MetricSource} backed by the Prometheus HTTP API.
 *
 * <p>
 * Issues one instant query ({@code GET /api/v1/query}) per {@link Reading}.
 * Each query is a PromQL template in which {@value #ENTITY_PLACEHOLDER} is
 * replaced by the entity name. The first sample of a successful vector
 * result becomes the reading; any failure (transport, HTTP status, JSON, an
 * empty result) leaves only that reading absent.
 * </p>
 *
 * <p>
 * The default templates aggregate every series of the entity into one
 * sample, so only the first sample is read. The error rate is the 5xx
 * fraction of all requests. Latency templates multiply the histogram
 * quantile by 1000 so that readings arrive in milliseconds.
 * </p>
 *
 * @since 1.0.0
 */
public class PrometheusMetricSource implements MetricSource {

    private static final Logger LOG = LoggerFactory.getLogger(PrometheusMetricSource.class);

    public static final String ENTITY_PLACEHOLDER = "{entity}";

    private static final Map<Reading, String> DEFAULT_QUERIES = defaultQueries();

    private final HttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String baseUrl;
    private final Duration timeout;
    private final Map<Reading, String> queries;

    /**
     * @param baseUrl   Prometheus base URL, e.g. {@code http://localhost:9090}
     * @param overrides query templates keyed by {@link Reading#key()}; replace
     *                  the defaults for those readings
     * @param timeout   per-request timeout
     */
    public PrometheusMetricSource(String baseUrl, Map<String, String> overrides, Duration timeout) {
        Objects.requireNonNull(baseUrl, "baseUrl must not be null");
        Objects.requireNonNull(overrides, "overrides must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.client = HttpClient.newBuilder().connectTimeout(timeout).build();

        Map<Reading, String> merged = new EnumMap<>(DEFAULT_QUERIES);
        for (Reading reading : Reading.values()) {
            String override = overrides.get(reading.key());
            if (override != null) {
                merged.put(reading, override);
            }
        }
        this.queries = Collections.unmodifiableMap(merged);
    }

    @Override
    public RawReadings read(String entity) {
        RawReadings readings = RawReadings.empty();
        for (Map.Entry<Reading, String> entry : queries.entrySet()) {
            String promql = expand(entry.getValue(), entity);
            try {
                String value = instantValue(promql);
                if (value != null) {
                    readings.put(entry.getKey(), value);
                }
            } catch (IOException e) {
                LOG.warn("[{}] Prometheus query for {} failed: {}", entity, entry.getKey().key(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("[{}] Interrupted while querying Prometheus", entity);
                break;
            }
        }
        return readings;
    }

    /**
     * @return the effective query template per reading
     */
    public Map<Reading, String> getQueries() {
        return queries;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String instantValue(String promql) throws IOException, InterruptedException {
        URI uri = URI.create(baseUrl + "/api/v1/query?query="
                + URLEncoder.encode(promql, StandardCharsets.UTF_8));
        HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
        HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException("HTTP " + response.statusCode() + " for query " + promql);
        }

        JsonNode root = mapper.readTree(response.body());
        if (!"success".equals(root.path("status").asText())) {
            throw new IOException("Query status '" + root.path("status").asText() + "' for " + promql);
        }
        JsonNode result = root.path("data").path("result");
        if (!result.isArray() || result.isEmpty()) {
            LOG.debug("Empty result for query {}", promql);
            return null;
        }
        // [ <unix time>, "<value>" ]
        JsonNode value = result.get(0).path("value");
        return value.isArray() && value.size() == 2 ? value.get(1).asText() : null;
    }

    static String expand(String template, String entity) {
        String escaped = entity.replace("\\", "\\\\").replace("\"", "\\\"");
        return template.replace(ENTITY_PLACEHOLDER, escaped);
    }

    private static Map<Reading, String> defaultQueries() {
        Map<Reading, String> q = new EnumMap<>(Reading.class);
        q.put(Reading.REQUEST_RATE, "sum(rate(http_requests_total{service=\"{entity}\"}[5m]))");
        // 5xx fraction of all requests; no traffic yields NaN, which reads as absent
        q.put(Reading.ERROR_RATE, "sum(rate(http_requests_total{service=\"{entity}\",status=~\"5..\"}[5m]))"
                + " / sum(rate(http_requests_total{service=\"{entity}\"}[5m]))");
        q.put(Reading.LATENCY_P50, latency("0.5"));
        q.put(Reading.LATENCY_P95, latency("0.95"));
        q.put(Reading.LATENCY_P99, latency("0.99"));
        q.put(Reading.CPU_USAGE, "sum(rate(container_cpu_usage_seconds_total{service=\"{entity}\"}[5m]))");
        q.put(Reading.MEMORY_USAGE, "sum(container_memory_usage_bytes{service=\"{entity}\"})");
        q.put(Reading.RESTART_COUNT, "sum(kube_pod_container_status_restarts_total{service=\"{entity}\"})");
        q.put(Reading.INSTANCE_COUNT, "count(kube_pod_info{service=\"{entity}\"})");
        return Collections.unmodifiableMap(q);
    }

    private static String latency(String quantile) {
        return "histogram_quantile(" + quantile
                + ", sum by (le) (rate(http_request_duration_seconds_bucket{service=\"{entity}\"}[5m]))) * 1000";
    }
}
