package com.receiptdesigner.config;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Formatting knobs shared by every render call.
 *
 * @param currencySymbol   prefix placed in front of monetary amounts
 * @param timestampPattern {@link DateTimeFormatter} pattern used for {@code TIMESTAMP}
 * @param zone             zone in which order timestamps are printed
 * @param clock            source of "now" when no order timestamp is available
 */
public record RenderSettings(String currencySymbol, String timestampPattern, ZoneId zone, Clock clock) {

    public static final String DEFAULT_CURRENCY_SYMBOL = "$";
    public static final String DEFAULT_TIMESTAMP_PATTERN = "MM/dd/yyyy HH:mm";

    public RenderSettings {
        Objects.requireNonNull(currencySymbol, "currencySymbol");
        Objects.requireNonNull(timestampPattern, "timestampPattern");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(clock, "clock");
        // fail fast on a bad pattern instead of on the first TIMESTAMP placeholder
        DateTimeFormatter.ofPattern(timestampPattern, Locale.ROOT);
    }

    public static RenderSettings defaults() {
        ZoneId zone = ZoneId.systemDefault();
        return new RenderSettings(DEFAULT_CURRENCY_SYMBOL, DEFAULT_TIMESTAMP_PATTERN, zone, Clock.system(zone));
    }

    public DateTimeFormatter timestampFormatter() {
        return DateTimeFormatter.ofPattern(timestampPattern, Locale.ROOT).withZone(zone);
    }

    public RenderSettings withClock(Clock newClock) {
        return new RenderSettings(currencySymbol, timestampPattern, zone, newClock);
    }

    public RenderSettings withZone(ZoneId newZone) {
        return new RenderSettings(currencySymbol, timestampPattern, newZone, clock.withZone(newZone));
    }

    public RenderSettings withCurrencySymbol(String symbol) {
        return new RenderSettings(symbol, timestampPattern, zone, clock);
    }
}
