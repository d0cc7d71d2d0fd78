package com.elssolution.hydromonitor.integration.remote;

import com.elssolution.hydromonitor.alerts.AlertService;
import com.elssolution.hydromonitor.domain.SensorReading;
import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * HTTP client for the device-reporting service: fetches the latest reading of one device.
 * Networking, retries and auth fallback live here; turning the body into a reading is
 * delegated to {@link ReadingNormalizer}.
 */
@Slf4j
@Service
@Getter @Setter
public class RemoteReadingClient {

    static final String API_KEY_HEADER = "X-API-KEY";
    static final String LATEST_READINGS_PATH = "/api/latest-readings/";
    private static final String CONTENT_TYPE_JSON = "application/json";
    private static final Pattern KEY_PARAM = Pattern.compile("[?&]key=");
    private static final Pattern LATEST_ENDPOINT = Pattern.compile("/api/latest-readings/", Pattern.CASE_INSENSITIVE);

    /** Linear backoff between timed-out attempts: BACKOFF_STEP_MS * attemptNumber. */
    static final long BACKOFF_STEP_MS = 300;

    // ----- Config -----
    /** Either a full /api/latest-readings/&lt;device&gt; endpoint or just the origin. */
    @Value("${hydro.remote.url:}")           private String baseUrl;
    @Value("${hydro.remote.apiKey:}")        private String apiKey;
    @Value("${hydro.remote.device:HZ1}")     private String device;
    @Value("${hydro.remote.cfAccessClientId:}")     private String cfAccessClientId;
    @Value("${hydro.remote.cfAccessClientSecret:}") private String cfAccessClientSecret;

    /** Retry a 401 once with ?key=... instead of the header (browser / proxy setups). */
    @Value("${hydro.remote.allowQueryKeyFallback:true}")
    private boolean allowQueryKeyFallback;

    /** Per-attempt timeout (ms). */
    @Value("${hydro.remote.timeoutMs:10000}")
    private long timeoutMs;

    /** Total attempts; only timeouts are retried. */
    @Value("${hydro.remote.maxAttempts:2}")
    private int maxAttempts;

    // ----- HTTP -----
    private final HttpClient httpClient;
    private final ReadingNormalizer normalizer;
    private final AlertService alerts;

    /** Composed once in {@link #init()}. */
    private String endpointUrl;

    @Autowired
    public RemoteReadingClient(ReadingNormalizer normalizer, AlertService alerts) {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .connectTimeout(Duration.ofSeconds(5))
                        .build(),
                normalizer, alerts);
    }

    RemoteReadingClient(HttpClient httpClient, ReadingNormalizer normalizer, AlertService alerts) {
        this.httpClient = httpClient;
        this.normalizer = normalizer;
        this.alerts = alerts;
    }

    @PostConstruct
    void init() {
        if (timeoutMs < 1) {
            log.warn("hydro.remote.timeoutMs < 1 ({}). Using 10000 ms.", timeoutMs);
            timeoutMs = 10_000;
        }
        if (maxAttempts < 1) {
            log.warn("hydro.remote.maxAttempts < 1 ({}). Using 1.", maxAttempts);
            maxAttempts = 1;
        }
        endpointUrl = composeEndpoint(baseUrl, device);
        log.info("Remote readings endpoint={} timeoutMs={} maxAttempts={} queryKeyFallback={} apiKeySet={}",
                endpointUrl, timeoutMs, maxAttempts, allowQueryKeyFallback, apiKey != null && !apiKey.isBlank());
    }

    /**
     * Latest reading from the remote service.
     *
     * @return empty when the service answered but the body holds no usable reading
     * @throws RemoteFetchException when no acceptable response could be obtained
     */
    public Optional<SensorReading> fetchLatestReading() throws RemoteFetchException {
        HttpResponse<String> response;
        try {
            response = fetchWithRetry();
            requireJsonOk(response);
        } catch (RemoteFetchException e) {
            if (e.getKind() == RemoteFetchException.Kind.AUTH) {
                alerts.raise("REMOTE_AUTH", e.getMessage() + " (check hydro.remote.apiKey)", AlertService.Severity.ERROR);
            } else {
                alerts.raise("REMOTE_DOWN", e.getKind() + ": " + e.getMessage(), AlertService.Severity.WARN);
            }
            throw e;
        }

        alerts.resolve("REMOTE_DOWN");
        alerts.resolve("REMOTE_AUTH");

        SensorReading reading = normalizer.normalize(response.body());
        if (reading == null) {
            alerts.raise("REMOTE_DECODE", "No usable reading in body: " + truncate(response.body(), 160),
                    AlertService.Severity.WARN);
            return Optional.empty();
        }
        alerts.resolve("REMOTE_DECODE");
        if (log.isDebugEnabled()) {
            log.debug("Remote reading id={} ts={} temp={} ph={} tds={}",
                    reading.getId(), reading.getTimestamp(), reading.getTemperature(), reading.getPh(), reading.getTdsLevel());
        }
        return Optional.of(reading);
    }

    /**
     * GET the endpoint with up to maxAttempts attempts. Timeouts are retried after
     * 300 ms * attempt; any other I/O failure is final. A 401 switches once to the
     * query-key URL (when allowed) without consuming an attempt.
     */
    public HttpResponse<String> fetchWithRetry() throws RemoteFetchException {
        String url = endpointUrl != null ? endpointUrl : composeEndpoint(baseUrl, device);
        Map<String, String> headers = baseHeaders();

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                HttpResponse<String> response = fetch(url, headers, timeoutMs);

                if (response.statusCode() == 401 && allowQueryKeyFallback && !KEY_PARAM.matcher(url).find()) {
                    url = withQueryKey(url, apiKey);
                    headers = new LinkedHashMap<>(headers);
                    headers.remove(API_KEY_HEADER);
                    log.warn("Remote HTTP 401 with header key, retrying once with query key");
                    response = fetch(url, headers, timeoutMs);
                }
                return response;

            } catch (HttpTimeoutException e) {
                if (attempt < maxAttempts) {
                    long backoffMs = BACKOFF_STEP_MS * attempt;
                    log.warn("Remote timeout after {} ms, retrying in {} ms (attempt {}/{})",
                            timeoutMs, backoffMs, attempt, maxAttempts);
                    sleep(backoffMs);
                    continue;
                }
                throw new RemoteFetchException(RemoteFetchException.Kind.TIMEOUT,
                        "timed out " + maxAttempts + "x after " + timeoutMs + " ms", e);

            } catch (IOException e) {
                throw new RemoteFetchException(RemoteFetchException.Kind.TRANSPORT, "I/O error: " + e.getMessage(), e);

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteFetchException(RemoteFetchException.Kind.TRANSPORT, "interrupted", e);
            }
        }
        // unreachable with maxAttempts >= 1
        throw new RemoteFetchException(RemoteFetchException.Kind.TIMEOUT, "no attempt made", null);
    }

    /** One GET with a hard per-request timeout; a timeout surfaces as {@link HttpTimeoutException}. */
    public HttpResponse<String> fetch(String url, Map<String, String> headers, long timeoutMs)
            throws IOException, InterruptedException {
        HttpRequest.Builder b = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMillis(Math.max(1, timeoutMs)))
                .GET();
        headers.forEach(b::header);
        return httpClient.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    // ===== Helpers =====

    Map<String, String> baseHeaders() {
        Map<String, String> h = new LinkedHashMap<>();
        h.put(API_KEY_HEADER, apiKey == null ? "" : apiKey);
        h.put("Accept", CONTENT_TYPE_JSON);
        h.put("User-Agent", "HydroMonitor/1.0");
        if (notBlank(cfAccessClientId) && notBlank(cfAccessClientSecret)) {
            h.put("CF-Access-Client-Id", cfAccessClientId);
            h.put("CF-Access-Client-Secret", cfAccessClientSecret);
        }
        return h;
    }

    private static void requireJsonOk(HttpResponse<String> response) throws RemoteFetchException {
        int sc = response.statusCode();
        if (sc == 401 || sc == 403) {
            throw new RemoteFetchException(RemoteFetchException.Kind.AUTH, sc, "HTTP " + sc);
        }
        if (sc / 100 != 2) {
            throw new RemoteFetchException(RemoteFetchException.Kind.HTTP_STATUS, sc,
                    "HTTP " + sc + " " + truncate(response.body(), 240));
        }
        String ct = response.headers().firstValue("Content-Type").orElse("");
        if (!ct.toLowerCase(Locale.ROOT).contains(CONTENT_TYPE_JSON)) {
            throw new RemoteFetchException(RemoteFetchException.Kind.BAD_CONTENT, sc, "Expected JSON, got '" + ct + "'");
        }
    }

    /** Full endpoint is kept as is; a bare origin gets /api/latest-readings/&lt;device&gt;. */
    static String composeEndpoint(String baseUrl, String device) {
        String trimmed = (baseUrl == null ? "" : baseUrl.trim()).replaceAll("/+$", "");
        if (LATEST_ENDPOINT.matcher(trimmed).find()) return trimmed;
        String dev = (device == null || device.isBlank()) ? "HZ1" : device.trim();
        return trimmed + LATEST_READINGS_PATH + dev;
    }

    static String withQueryKey(String url, String key) {
        String sep = url.contains("?") ? "&" : "?";
        return url + sep + "key=" + URLEncoder.encode(key == null ? "" : key, StandardCharsets.UTF_8);
    }

    private static void sleep(long ms) throws RemoteFetchException {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteFetchException(RemoteFetchException.Kind.TRANSPORT, "interrupted during backoff", e);
        }
    }

    private static boolean notBlank(String s) {
        return s != null && !s.isBlank();
    }

    private static String truncate(String s, int limit) {
        if (s == null) return "";
        return s.length() <= limit ? s : s.substring(0, Math.max(0, limit)) + "…";
    }
}
