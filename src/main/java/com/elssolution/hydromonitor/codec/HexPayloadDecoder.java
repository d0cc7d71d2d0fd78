package com.elssolution.hydromonitor.codec;

import com.elssolution.hydromonitor.domain.DecodedPayload;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Decodes the hex payloads reported by the field kits.
 *
 * Every field is an unsigned 16-bit big-endian word written as 4 hex digits;
 * words follow each other with no separator. The device-code prefix picks the layout:
 * <pre>
 *   CZ        ph/100, moisture/10, ec/100, temperature/10
 *   MZ, SZ    ph/100, ec/100, temperature/10
 *   GZ        temperature/10, humidity/10, light
 *   HZ        ph/100, tdsLevel/10, temperature/10
 * </pre>
 * Anything malformed decodes to {@link Optional#empty()}; there is no partial result.
 */
@Component
public class HexPayloadDecoder {

    static final int WORD_HEX_CHARS = 4;
    static final int MIN_HEX_CHARS = 6;

    public Optional<DecodedPayload> decode(String hexString, String deviceCode) {
        if (hexString == null || deviceCode == null) return Optional.empty();
        String hex = hexString.trim().toLowerCase(Locale.ROOT);
        if (hex.length() < MIN_HEX_CHARS) return Optional.empty();

        try {
            if (deviceCode.startsWith("CZ")) {
                // chili kit, 4 sensors
                requireWords(hex, 4);
                return Optional.of(DecodedPayload.builder()
                        .ph(word(hex, 0) / 100.0)
                        .moisture(word(hex, 1) / 10.0)
                        .ec(word(hex, 2) / 100.0)
                        .temperature(word(hex, 3) / 10.0)
                        .build());
            }
            if (deviceCode.startsWith("MZ") || deviceCode.startsWith("SZ")) {
                // melon / lettuce
                requireWords(hex, 3);
                return Optional.of(DecodedPayload.builder()
                        .ph(word(hex, 0) / 100.0)
                        .ec(word(hex, 1) / 100.0)
                        .temperature(word(hex, 2) / 10.0)
                        .build());
            }
            if (deviceCode.startsWith("GZ")) {
                // greenhouse climate
                requireWords(hex, 3);
                return Optional.of(DecodedPayload.builder()
                        .temperature(word(hex, 0) / 10.0)
                        .humidity(word(hex, 1) / 10.0)
                        .light((double) word(hex, 2))
                        .build());
            }
            if (deviceCode.startsWith("HZ")) {
                // hydroponic
                requireWords(hex, 3);
                return Optional.of(DecodedPayload.builder()
                        .ph(word(hex, 0) / 100.0)
                        .tdsLevel(word(hex, 1) / 10.0)
                        .temperature(word(hex, 2) / 10.0)
                        .build());
            }
            return Optional.empty();
        } catch (IllegalArgumentException malformed) {
            // NumberFormatException is an IllegalArgumentException
            return Optional.empty();
        }
    }

    /** Unsigned value of the index-th 16-bit word. */
    private static int word(String hex, int index) {
        int from = index * WORD_HEX_CHARS;
        String slot = hex.substring(from, from + WORD_HEX_CHARS);
        for (int i = 0; i < slot.length(); i++) {
            if (Character.digit(slot.charAt(i), 16) < 0) {
                throw new NumberFormatException("not hex: " + slot);
            }
        }
        return Integer.parseInt(slot, 16) & 0xFFFF;
    }

    private static void requireWords(String hex, int words) {
        if (hex.length() < words * WORD_HEX_CHARS) {
            throw new IllegalArgumentException(
                    "need " + words + " words (" + words * WORD_HEX_CHARS + " hex chars), got " + hex.length());
        }
    }
}
