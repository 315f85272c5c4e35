package com.pgmetrics.log.parser;

import java.io.File;
import java.io.IOException;
import java.time.Instant;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pgmetrics.log.parser.accumulator.LogFactsAccumulator;
import com.pgmetrics.log.parser.model.AutoVacuum;
import com.pgmetrics.log.parser.model.Deadlock;
import com.pgmetrics.log.parser.model.Plan;

/**
 * Writes the facts collected from the logs as a JSON document.
 */
public class JsonReportGenerator {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static void generateReport(String fileName, LogFactsAccumulator accumulator,
            Instant windowStart) throws IOException {
        mapper.writerWithDefaultPrettyPrinter().writeValue(new File(fileName), toJson(accumulator, windowStart));
    }

    public static ObjectNode toJson(LogFactsAccumulator accumulator, Instant windowStart) {
        ObjectNode report = mapper.createObjectNode();

        ObjectNode metadata = mapper.createObjectNode();
        metadata.put("generatedAt", Instant.now().toString());
        metadata.put("windowStart", windowStart != null ? windowStart.toString() : null);
        report.set("metadata", metadata);

        ArrayNode plans = mapper.createArrayNode();
        for (Plan p : accumulator.getPlans()) {
            ObjectNode node = mapper.createObjectNode();
            node.put("database", p.getDatabase());
            node.put("user", p.getUserName());
            node.put("format", p.getFormat().getName());
            node.put("at", p.getAt());
            node.put("query", p.getQuery());
            node.put("plan", p.getPlan());
            plans.add(node);
        }
        report.set("plans", plans);

        ArrayNode autoVacuums = mapper.createArrayNode();
        for (AutoVacuum av : accumulator.getAutoVacuums()) {
            ObjectNode node = mapper.createObjectNode();
            node.put("at", av.getAt());
            node.put("table", av.getTable());
            node.put("elapsed", av.getElapsed());
            autoVacuums.add(node);
        }
        report.set("autovacuums", autoVacuums);

        ArrayNode deadlocks = mapper.createArrayNode();
        for (Deadlock d : accumulator.getDeadlocks()) {
            ObjectNode node = mapper.createObjectNode();
            node.put("at", d.getAt());
            node.put("detail", d.getDetail());
            deadlocks.add(node);
        }
        report.set("deadlocks", deadlocks);

        return report;
    }
}
