package com.equipmenthealth.scheduler.parse;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import com.equipmenthealth.scheduler.error.ErrorContext;
import com.equipmenthealth.scheduler.error.MalformedResultException;
import com.equipmenthealth.scheduler.model.AnomalyRecord;
import com.equipmenthealth.scheduler.model.DiagnosticContribution;
import com.equipmenthealth.scheduler.util.JsonSupport;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Parses one execution output artifact into anomaly records.
 *
 * <p>The artifact is either JSON Lines (one object per line) or a single JSON array of objects.
 * Parsing is all-or-nothing: the first bad record, or a timestamp repeated inside the artifact,
 * fails the whole artifact with {@link MalformedResultException} and nothing is returned.
 * Content is only ever read as JSON data.</p>
 */
public final class AnomalyResultParser {
    private final ResultRecordValidator validator = new ResultRecordValidator();

    public List<AnomalyRecord> parse(InputStream in, ErrorContext context) throws IOException {
        return parse(in.readAllBytes(), context);
    }

    public List<AnomalyRecord> parse(byte[] content, ErrorContext context) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return parse(decoder.decode(ByteBuffer.wrap(content)).toString(), context);
        } catch (CharacterCodingException ex) {
            throw new MalformedResultException("Artifact is not valid UTF-8: " + ex, context, ex);
        }
    }

    public List<AnomalyRecord> parse(String content, ErrorContext context) {
        String trimmed = content.strip();
        List<JsonNode> nodes = new ArrayList<>();
        List<Integer> lineNumbers = new ArrayList<>();
        if (trimmed.startsWith("[")) {
            JsonNode array = readTree(trimmed, 1, context);
            for (JsonNode node : array) {
                nodes.add(node);
                lineNumbers.add(nodes.size());
            }
        } else {
            String[] lines = content.split("\r?\n", -1);
            for (int i = 0; i < lines.length; i++) {
                if (lines[i].isBlank()) {
                    continue;
                }
                nodes.add(readTree(lines[i], i + 1, context));
                lineNumbers.add(i + 1);
            }
        }

        List<AnomalyRecord> records = new ArrayList<>(nodes.size());
        Set<Instant> seen = new HashSet<>();
        for (int i = 0; i < nodes.size(); i++) {
            AnomalyRecord record = toRecord(nodes.get(i), lineNumbers.get(i), context);
            if (!seen.add(record.timestamp())) {
                throw new MalformedResultException(
                        "Record " + lineNumbers.get(i) + " repeats timestamp " + record.timestamp(), context);
            }
            records.add(record);
        }
        return records;
    }

    private AnomalyRecord toRecord(JsonNode node, int recordNumber, ErrorContext context) {
        ResultRecordValidator.ValidationResult validation = validator.validate(node);
        if (!validation.valid) {
            throw new MalformedResultException(
                    "Record " + recordNumber + " is invalid (" + validation.reason + "): " + validation.details, context);
        }
        Instant timestamp = JsonNodeUtils.parseIsoInstant(node.get("timestamp"));
        boolean anomaly = node.get("prediction").asLong() == 1L;
        List<DiagnosticContribution> contributions = new ArrayList<>();
        if (anomaly) {
            for (JsonNode entry : node.get("diagnostics")) {
                contributions.add(DiagnosticContribution.of(entry.get("name").asText(), entry.get("value").asDouble()));
            }
        }
        return new AnomalyRecord(timestamp, anomaly, contributions);
    }

    private static JsonNode readTree(String json, int recordNumber, ErrorContext context) {
        try {
            JsonNode node = JsonSupport.STRICT_MAPPER.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new MalformedResultException("Record " + recordNumber + " is empty", context);
            }
            return node;
        } catch (JsonProcessingException ex) {
            throw new MalformedResultException(
                    "Record " + recordNumber + " is not valid JSON: " + ex.getOriginalMessage(), context, ex);
        }
    }
}
