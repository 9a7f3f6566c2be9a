package com.receiptdesigner.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConfigServiceTest {

    @AfterEach
    void clearOverrides() {
        System.clearProperty(ConfigService.CURRENCY_SYMBOL_KEY);
        System.clearProperty(ConfigService.TIMESTAMP_PATTERN_KEY);
        System.clearProperty(ConfigService.TIME_ZONE_KEY);
    }

    @Test
    void fallsBackToBuiltInDefaults() {
        RenderSettings settings = new ConfigService(new Properties()).renderSettings();

        assertEquals("$", settings.currencySymbol());
        assertEquals("MM/dd/yyyy HH:mm", settings.timestampPattern());
        assertEquals(ZoneId.systemDefault(), settings.zone());
    }

    @Test
    void filePropertiesOverrideDefaults() {
        Properties file = new Properties();
        file.setProperty(ConfigService.CURRENCY_SYMBOL_KEY, "£");
        file.setProperty(ConfigService.TIME_ZONE_KEY, "Europe/London");

        RenderSettings settings = new ConfigService(file).renderSettings();

        assertEquals("£", settings.currencySymbol());
        assertEquals(ZoneId.of("Europe/London"), settings.zone());
    }

    @Test
    void systemPropertiesWinOverFile() {
        Properties file = new Properties();
        file.setProperty(ConfigService.CURRENCY_SYMBOL_KEY, "£");
        System.setProperty(ConfigService.CURRENCY_SYMBOL_KEY, " € ");
        System.setProperty(ConfigService.TIMESTAMP_PATTERN_KEY, "yyyy-MM-dd");

        RenderSettings settings = new ConfigService(file).renderSettings();

        assertEquals("€", settings.currencySymbol());
        assertEquals("yyyy-MM-dd", settings.timestampPattern());
    }

    @Test
    void invalidValuesFallBackToDefaults() {
        System.setProperty(ConfigService.TIMESTAMP_PATTERN_KEY, "{{broken");
        System.setProperty(ConfigService.TIME_ZONE_KEY, "Mars/Olympus");

        RenderSettings settings = new ConfigService(new Properties()).renderSettings();

        assertEquals(RenderSettings.DEFAULT_TIMESTAMP_PATTERN, settings.timestampPattern());
        assertEquals(ZoneId.systemDefault(), settings.zone());
    }

    @Test
    void bundledPropertiesOnlyCarryComments() {
        assertEquals(0, ConfigService.loadFileProperties(ConfigService.PROPERTIES_RESOURCE).size());
        assertEquals(0, ConfigService.loadFileProperties("does-not-exist.properties").size());
        assertSame(ConfigService.getInstance(), ConfigService.getInstance());
    }

    @Test
    void settingsRejectBadPattern() {
        ZoneId utc = ZoneId.of("UTC");
        assertThrows(IllegalArgumentException.class,
            () -> new RenderSettings("$", "{{", utc, Clock.system(utc)));
    }
}
