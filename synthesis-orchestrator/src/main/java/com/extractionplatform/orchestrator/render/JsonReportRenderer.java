package com.extractionplatform.orchestrator.render;

import com.extractionplatform.orchestrator.run.RunReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Pretty-printed JSON of the whole report, timestamps as ISO-8601.
 */
@Component
public class JsonReportRenderer implements ReportRenderer {

    private final ObjectMapper mapper;

    public JsonReportRenderer(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String mediaType() {
        return MediaType.APPLICATION_JSON_VALUE;
    }

    @Override
    public String render(RunReport report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render run " + report.runId(), e);
        }
    }
}
