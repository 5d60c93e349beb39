package com.fintech.strategyengine.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Candle timeframes a strategy can be bound to.
 * Each carries its short code ("1m"), duration and the code used by the historical data vendor.
 */
public enum Timeframe {

    M1("1m", 60_000L, "ONE_MINUTE"),
    M3("3m", 180_000L, "THREE_MINUTE"),
    M5("5m", 300_000L, "FIVE_MINUTE"),
    M15("15m", 900_000L, "FIFTEEN_MINUTE"),
    M30("30m", 1_800_000L, "THIRTY_MINUTE"),
    H1("1h", 3_600_000L, "ONE_HOUR"),
    D1("1d", 86_400_000L, "ONE_DAY");

    private final String code;
    private final long milliseconds;
    private final String historicalCode;

    Timeframe(String code, long milliseconds, String historicalCode) {
        this.code = code;
        this.milliseconds = milliseconds;
        this.historicalCode = historicalCode;
    }

    /** Returns the short code, e.g. "15m". */
    public String code() {
        return code;
    }

    /** Returns bucket duration in milliseconds. */
    public long toMillis() {
        return milliseconds;
    }

    /** Returns the interval name understood by the historical candle API. */
    public String historicalCode() {
        return historicalCode;
    }

    /**
     * Parses a short code ("5m") or enum name ("M5"), case-insensitively.
     *
     * @throws IllegalArgumentException if the value names no supported timeframe
     */
    public static Timeframe fromCode(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Timeframe timeframe : values()) {
                if (timeframe.code.equals(normalized) || timeframe.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return timeframe;
                }
            }
        }
        throw new IllegalArgumentException(
            "Unsupported timeframe: " + value + ". Must be one of: " + supportedCodes()
        );
    }

    /** Returns all short codes, comma separated. */
    public static String supportedCodes() {
        return Arrays.stream(values())
            .map(Timeframe::code)
            .collect(Collectors.joining(", "));
    }
}
