package com.elssolution.hydromonitor.integration.remote;

import com.elssolution.hydromonitor.codec.HexPayloadDecoder;
import com.elssolution.hydromonitor.domain.DecodedPayload;
import com.elssolution.hydromonitor.domain.SensorReading;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Turns the upstream JSON into a {@link SensorReading}.
 *
 * The upstream has shipped several envelopes over time, so every field is resolved
 * by a short ordered list of rules; the first rule that yields a value wins.
 * Returns null when there is nothing usable in the body (not an error to retry).
 */
@Slf4j
@Component
public class ReadingNormalizer {

    static final String UNKNOWN_DEVICE = "UNKNOWN";

    private static final List<Function<JsonNode, Optional<String>>> DEVICE_CODE_RULES = List.of(
            n -> text(n.path("device_code")),
            n -> text(n.path("device")),
            n -> text(n.path("code")));

    private static final List<Function<JsonNode, Optional<String>>> ENCODED_PAYLOAD_RULES = List.of(
            n -> text(n.path("reading").path("encoded_data")),
            n -> text(n.path("encoded_data")),
            n -> text(n.path("hex")),
            n -> text(n.path("payload")));

    private static final List<Function<JsonNode, Optional<Instant>>> TIMESTAMP_RULES = List.of(
            n -> instant(n.path("reading").path("timestamp")),
            n -> instant(n.path("timestamp")),
            n -> instant(n.path("created_at")),
            n -> instant(n.path("time")));

    private static final List<Function<JsonNode, Optional<String>>> ID_RULES = List.of(
            n -> text(n.path("id")),
            n -> text(n.path("_id")),
            n -> text(n.path("reading_id")),
            n -> text(n.path("reading").path("id")));

    private final HexPayloadDecoder decoder;
    private final ObjectMapper objectMapper;

    /** Device assumed when the body names none (e.g. the endpoint is already per-device). */
    @Setter
    @Value("${hydro.remote.device:HZ1}")
    private String configuredDevice;

    public ReadingNormalizer(HexPayloadDecoder decoder, ObjectMapper objectMapper) {
        this.decoder = decoder;
        this.objectMapper = objectMapper;
    }

    /** Parses then normalizes; unparseable JSON gives null. */
    public SensorReading normalize(String rawJson) {
        if (rawJson == null || rawJson.isBlank()) return null;
        try {
            return normalize(objectMapper.readTree(rawJson));
        } catch (Exception e) {
            log.warn("remote_body_unparseable: {}", e.getMessage());
            return null;
        }
    }

    public SensorReading normalize(JsonNode data) {
        if (data == null || !data.isObject()) return null;

        String deviceCode = firstOf(data, DEVICE_CODE_RULES)
                .or(() -> Optional.ofNullable(configuredDevice).filter(s -> !s.isBlank()))
                .orElse(UNKNOWN_DEVICE);
        Optional<String> encoded = firstOf(data, ENCODED_PAYLOAD_RULES);

        long nowMs = System.currentTimeMillis();
        Instant timestamp = firstOf(data, TIMESTAMP_RULES).orElse(Instant.ofEpochMilli(nowMs));
        String id = firstOf(data, ID_RULES).orElse("ext_" + nowMs);

        if (encoded.isEmpty()) {
            if (looksDecoded(data)) {
                double tds = data.has("tdsLevel") ? number(data.path("tdsLevel")) : number(data.path("ec"));
                return SensorReading.builder()
                        .id(id)
                        .timestamp(timestamp)
                        .createdAt(Instant.ofEpochMilli(nowMs))
                        .temperature(number(data.path("temperature")))
                        .ph(number(data.path("ph")))
                        .tdsLevel(tds)
                        .build();
            }
            log.debug("remote_body_without_payload device={}", deviceCode);
            return null;
        }

        Optional<DecodedPayload> decoded = decoder.decode(encoded.get(), deviceCode);
        if (decoded.isEmpty()) {
            log.warn("hex_decode_failed device={} hex={}", deviceCode, encoded.get());
            return null;
        }
        DecodedPayload p = decoded.get();
        return SensorReading.builder()
                .id(id)
                .timestamp(timestamp)
                .createdAt(Instant.ofEpochMilli(nowMs))
                .temperature(orZero(p.getTemperature()))
                .ph(orZero(p.getPh()))
                .tdsLevel(p.tdsOrEc())
                .build();
    }

    // ===== Rules helpers =====

    static <T> Optional<T> firstOf(JsonNode data, List<Function<JsonNode, Optional<T>>> rules) {
        for (Function<JsonNode, Optional<T>> rule : rules) {
            Optional<T> v = rule.apply(data);
            if (v.isPresent()) return v;
        }
        return Optional.empty();
    }

    /** Already-decoded envelope: numeric temperature plus at least one of ph / tdsLevel / ec. */
    private static boolean looksDecoded(JsonNode n) {
        return n.path("temperature").isNumber()
                && (n.has("ph") || n.has("tdsLevel") || n.has("ec"));
    }

    /** Non-blank scalar as text; objects, arrays, null and missing nodes give empty. */
    private static Optional<String> text(JsonNode n) {
        if (n == null || !n.isValueNode() || n.isNull()) return Optional.empty();
        String s = n.asText();
        return (s == null || s.isBlank()) ? Optional.empty() : Optional.of(s.trim());
    }

    /** ISO-8601 instant / offset date-time / local date-time (UTC), or epoch millis. */
    private static Optional<Instant> instant(JsonNode n) {
        if (n == null || n.isMissingNode() || n.isNull()) return Optional.empty();
        if (n.isIntegralNumber()) {
            long v = n.asLong();
            return v > 0 ? Optional.of(Instant.ofEpochMilli(v)) : Optional.empty();
        }
        Optional<String> s = text(n);
        if (s.isEmpty()) return Optional.empty();
        String raw = s.get();
        try { return Optional.of(Instant.parse(raw)); } catch (DateTimeParseException ignore) { /* next format */ }
        try { return Optional.of(OffsetDateTime.parse(raw).toInstant()); } catch (DateTimeParseException ignore) { /* next format */ }
        try {
            return Optional.of(LocalDateTime.parse(raw.replace(' ', 'T')).toInstant(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    /** Number, or numeric text; anything else (or non-finite) is 0. */
    private static double number(JsonNode n) {
        double v;
        if (n.isNumber()) {
            v = n.asDouble();
        } else if (n.isTextual()) {
            try {
                v = Double.parseDouble(n.asText().trim());
            } catch (NumberFormatException e) {
                v = 0.0;
            }
        } else {
            v = 0.0;
        }
        return Double.isFinite(v) ? v : 0.0;
    }

    private static double orZero(Double v) {
        return (v == null || !Double.isFinite(v)) ? 0.0 : v;
    }
}
