package com.equipmenthealth.scheduler.timeline;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import com.equipmenthealth.scheduler.model.AnomalyRecord;
import com.equipmenthealth.scheduler.model.DiagnosticContribution;
import com.equipmenthealth.scheduler.util.JsonSupport;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Writes a timeline as JSON Lines in the same shape as an execution output artifact.
 */
public final class TimelineWriter {
    private TimelineWriter() {}

    public static void write(Timeline timeline, OutputStream out) throws IOException {
        Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        for (AnomalyRecord record : timeline.records()) {
            writer.write(JsonSupport.MAPPER.writeValueAsString(toNode(record)));
            writer.write('\n');
        }
        writer.flush();
    }

    static ObjectNode toNode(AnomalyRecord record) {
        ObjectNode node = JsonSupport.MAPPER.createObjectNode();
        node.put("timestamp", record.timestamp().toString());
        node.put("prediction", record.isAnomaly() ? 1 : 0);
        if (record.isAnomaly()) {
            ArrayNode diagnostics = node.putArray("diagnostics");
            for (DiagnosticContribution contribution : record.contributions()) {
                diagnostics.addObject()
                        .put("name", contribution.sensorName())
                        .put("value", contribution.fraction());
            }
        }
        return node;
    }
}
