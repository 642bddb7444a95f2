package com.equipmenthealth.scheduler.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * {@code version+commit} identity stamped into job logs and reconcile summaries, read from the
 * filtered {@code build-info.properties} resource.
 */
public final class BuildMetadata {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(BuildMetadata.class);

    private static final String IDENTITY = identityFrom("build-info.properties");

    private BuildMetadata() {}

    public static String identity() {
        return IDENTITY;
    }

    static String identityFrom(String resource) {
        Properties props = new Properties();
        try (InputStream in = BuildMetadata.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            LOG.warn("Could not read {}: {}", resource, ex.getMessage());
        }
        return identityOf(props.getProperty("build.version"), props.getProperty("build.git.commit"));
    }

    /**
     * Unset, blank or unfiltered {@code ${...}} values become {@code dev} and {@code unknown}.
     */
    static String identityOf(String version, String gitCommit) {
        return resolvedOr(version, "dev") + "+" + resolvedOr(gitCommit, "unknown");
    }

    private static String resolvedOr(String value, String fallback) {
        String trimmed = value == null ? "" : value.trim();
        boolean unfiltered = trimmed.startsWith("${") && trimmed.endsWith("}");
        return trimmed.isEmpty() || unfiltered ? fallback : trimmed;
    }
}
