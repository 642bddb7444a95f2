package com.equipmenthealth.scheduler.model;

import java.util.Objects;

/**
 * Share of responsibility a single sensor carries for an anomalous record.
 *
 * <p>The qualified sensor name is {@code <component>\<tag>}.</p>
 */
public final class DiagnosticContribution {
    public static final char NAME_SEPARATOR = '\\';

    private final String sensorName;
    private final String component;
    private final String tag;
    private final double fraction;

    private DiagnosticContribution(String sensorName, String component, String tag, double fraction) {
        this.sensorName = sensorName;
        this.component = component;
        this.tag = tag;
        this.fraction = fraction;
    }

    /**
     * @throws IllegalArgumentException when the name has no component separator or the fraction lies outside [0, 1]
     */
    public static DiagnosticContribution of(String qualifiedName, double fraction) {
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        int separator = qualifiedName.indexOf(NAME_SEPARATOR);
        if (separator <= 0 || separator == qualifiedName.length() - 1) {
            throw new IllegalArgumentException("Sensor name is not <component>\\<tag>: " + qualifiedName);
        }
        if (Double.isNaN(fraction) || fraction < 0.0 || fraction > 1.0) {
            throw new IllegalArgumentException("Contribution of " + qualifiedName + " outside [0, 1]: " + fraction);
        }
        return new DiagnosticContribution(
                qualifiedName,
                qualifiedName.substring(0, separator),
                qualifiedName.substring(separator + 1),
                fraction);
    }

    public String sensorName() {
        return sensorName;
    }

    public String component() {
        return component;
    }

    public String tag() {
        return tag;
    }

    public double fraction() {
        return fraction;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof DiagnosticContribution)) {
            return false;
        }
        DiagnosticContribution that = (DiagnosticContribution) other;
        return sensorName.equals(that.sensorName) && Double.compare(fraction, that.fraction) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sensorName, fraction);
    }

    @Override
    public String toString() {
        return sensorName + "=" + fraction;
    }
}
