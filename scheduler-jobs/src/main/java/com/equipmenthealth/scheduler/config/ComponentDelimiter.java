package com.equipmenthealth.scheduler.config;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.InvalidConfigurationException;

import java.util.Locale;

/**
 * Separator between the component name and the timestamp in an input file name.
 */
public enum ComponentDelimiter {
    HYPHEN("-"),
    UNDERSCORE("_"),
    SPACE(" ");

    private final String symbol;

    ComponentDelimiter(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Accepts the literal symbol or the constant name. The raw value is not trimmed since a single
     * space is itself a valid delimiter.
     */
    public static ComponentDelimiter parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidConfigurationException("component_delimiter is required", ErrorContext.NONE);
        }
        for (ComponentDelimiter candidate : values()) {
            if (candidate.symbol.equals(raw) || candidate.name().equals(raw.trim().toUpperCase(Locale.ROOT))) {
                return candidate;
            }
        }
        throw new InvalidConfigurationException(
                "component_delimiter must be one of '-', '_', ' ' but was '" + raw + "'", ErrorContext.NONE);
    }
}
