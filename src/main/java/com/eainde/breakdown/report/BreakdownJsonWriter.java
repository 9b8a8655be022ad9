package com.eainde.breakdown.report;

import com.eainde.breakdown.exception.BreakdownException;
import com.eainde.breakdown.model.Breakdown;
import com.eainde.breakdown.model.ScriptBreakdown;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Writes breakdowns as pretty-printed JSON with snake_case field names, the format the
 * report renderer reads.
 */
@Component
public class BreakdownJsonWriter {

    private final ObjectWriter writer;

    public BreakdownJsonWriter(ObjectMapper objectMapper) {
        this.writer = objectMapper.writerWithDefaultPrettyPrinter();
    }

    public String write(ScriptBreakdown breakdown) {
        return toJson(breakdown);
    }

    public String write(Breakdown breakdown) {
        return toJson(breakdown);
    }

    public void write(ScriptBreakdown breakdown, OutputStream out) {
        try {
            writer.writeValue(out, breakdown);
        } catch (IOException e) {
            throw new BreakdownException("Failed to write breakdown JSON", e);
        }
    }

    private String toJson(Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new BreakdownException("Failed to serialise breakdown to JSON", e);
        }
    }
}
