package com.equipmenthealth.scheduler.parse;

import com.fasterxml.jackson.databind.JsonNode;

import com.equipmenthealth.scheduler.model.DiagnosticContribution;

import java.util.HashSet;
import java.util.Set;

/**
 * Shape check for one record of an execution output artifact:
 *
 * <pre>
 * { "timestamp": ISO-8601, "prediction": 0 | 1,
 *   "diagnostics": [ { "name": "component\tag", "value": 0..1 }, ... ] }
 * </pre>
 *
 * Diagnostics must be non-empty when prediction is 1 and empty or absent when it is 0.
 * Unknown fields are ignored.
 */
public class ResultRecordValidator {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(ResultRecordValidator.class);

    public ValidationResult validate(JsonNode root) {
        if (root == null || !root.isObject()) {
            return invalid("root_not_object", "Record is not a JSON object");
        }

        if (JsonNodeUtils.parseIsoInstant(root.get("timestamp")) == null) {
            return invalid("bad_timestamp", "timestamp is missing or not an ISO-8601 string: " + root.get("timestamp"));
        }

        Long prediction = JsonNodeUtils.asNullableIntegral(root.get("prediction"));
        if (prediction == null || (prediction != 0L && prediction != 1L)) {
            return invalid("bad_prediction", "prediction must be 0 or 1 but was " + root.get("prediction"));
        }

        JsonNode diagnostics = root.get("diagnostics");
        boolean hasDiagnostics = !JsonNodeUtils.isAbsent(diagnostics);
        if (hasDiagnostics && !diagnostics.isArray()) {
            return invalid("bad_diagnostics", "diagnostics must be an array");
        }
        int count = hasDiagnostics ? diagnostics.size() : 0;
        if (prediction == 1L && count == 0) {
            return invalid("missing_diagnostics", "Anomalous record has no diagnostics");
        }
        if (prediction == 0L && count > 0) {
            return invalid("unexpected_diagnostics", "Normal record carries " + count + " diagnostics");
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < count; i++) {
            JsonNode entry = diagnostics.get(i);
            if (!entry.isObject()) {
                return invalid("bad_diagnostic", "diagnostics[" + i + "] is not an object");
            }
            String name = JsonNodeUtils.asNullableText(entry.get("name"));
            if (name == null || name.indexOf(DiagnosticContribution.NAME_SEPARATOR) <= 0
                    || name.endsWith(String.valueOf(DiagnosticContribution.NAME_SEPARATOR))) {
                return invalid("bad_sensor_name", "diagnostics[" + i + "].name is not <component>\\<tag>: " + entry.get("name"));
            }
            JsonNode value = entry.get("value");
            if (JsonNodeUtils.isAbsent(value) || !value.isNumber()) {
                return invalid("bad_contribution", "diagnostics[" + i + "].value is not a number");
            }
            double fraction = value.asDouble();
            if (Double.isNaN(fraction) || fraction < 0.0 || fraction > 1.0) {
                return invalid("bad_contribution", "diagnostics[" + i + "].value outside [0, 1]: " + fraction);
            }
            if (!names.add(name)) {
                return invalid("duplicate_sensor", "diagnostics repeat sensor " + name);
            }
        }
        return ValidationResult.VALID;
    }

    private static ValidationResult invalid(String reason, String details) {
        LOG.debug("Result record rejected: {} ({})", reason, details);
        return new ValidationResult(false, reason, details);
    }

    public static class ValidationResult {
        static final ValidationResult VALID = new ValidationResult(true, null, null);

        public final boolean valid;
        public final String reason;
        public final String details;

        private ValidationResult(boolean valid, String reason, String details) {
            this.valid = valid;
            this.reason = reason;
            this.details = details;
        }
    }
}
