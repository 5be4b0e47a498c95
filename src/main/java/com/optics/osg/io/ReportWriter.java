package com.optics.osg.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import com.optics.osg.api.OpticException;

/** Serializes reports to JSON. */
public final class ReportWriter {
    private static final Logger log = LogManager.getLogger(ReportWriter.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(Object report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            throw new OpticException(OpticException.Kind.OTHER, "could not serialize report: " + e.getMessage(), e);
        }
    }

    public void write(Object report, Path path) throws IOException {
        Files.writeString(path, toJson(report));
        log.info("Report written to {}", path);
    }

    public AnalysisReport readAnalysisReport(String json) throws IOException {
        return mapper.readValue(json, AnalysisReport.class);
    }
}
