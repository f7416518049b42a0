package com.policysentinel.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.policysentinel.core.fixture.FixtureResult;
import com.policysentinel.core.validation.ValidationReport;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes reports and fixture results to pretty-printed JSON.
 *
 * <p>
 * Key order is fixed, so identical reports print byte-identical output.
 * </p>
 */
final class ReportJsonWriter {

    private final ObjectMapper mapper;

    ReportJsonWriter() {
        this.mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    String write(ValidationReport report) {
        return serialize(report);
    }

    String write(FixtureResult result) {
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("fixture_id", result.getFixture().getFixtureId());
        json.put("passed", result.isPassed());
        json.put("failures", result.getFailures());
        json.put("report", result.getReport());
        return serialize(json);
    }

    private String serialize(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report", e);
        }
    }
}
