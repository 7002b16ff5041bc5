package com.wpanther.ticketbulkops.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.wpanther.ticketbulkops.operation.ExportedFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders operation results as downloadable CSV or JSON files
 */
@Component
@Slf4j
public class ResultExportUtil {

    public static final String FORMAT_CSV = "csv";
    public static final String FORMAT_JSON = "json";

    public static final String MIME_CSV = "text/csv";
    public static final String MIME_JSON = "application/json";

    private final ObjectMapper prettyMapper;

    public ResultExportUtil(ObjectMapper objectMapper) {
        this.prettyMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Pretty printed JSON document
     */
    public ExportedFile json(Object data, String filename) {
        try {
            byte[] content = prettyMapper.writeValueAsBytes(data);
            return new ExportedFile(content, MIME_JSON, filename);
        } catch (JsonProcessingException e) {
            log.error("Failed to render JSON export {}", filename, e);
            throw new IllegalStateException("Failed to render JSON export: " + e.getMessage(), e);
        }
    }

    /**
     * CSV document written row by row by the caller
     */
    public ExportedFile csv(CsvWriter writer, String filename) {
        StringWriter output = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(output, CSVFormat.DEFAULT)) {
            writer.write(printer);
        } catch (IOException e) {
            log.error("Failed to render CSV export {}", filename, e);
            throw new UncheckedIOException("Failed to render CSV export: " + e.getMessage(), e);
        }
        return new ExportedFile(output.toString().getBytes(StandardCharsets.UTF_8), MIME_CSV, filename);
    }

    @FunctionalInterface
    public interface CsvWriter {
        void write(CSVPrinter printer) throws IOException;
    }

    // Helpers for reading loosely typed result maps

    public static String string(Map<String, Object> data, String key, String fallback) {
        Object value = data.get(key);
        return value == null ? fallback : String.valueOf(value);
    }

    public static boolean flag(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof Boolean ? (Boolean) value : Boolean.parseBoolean(String.valueOf(value));
    }

    public static List<?> list(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof List ? (List<?>) value : Collections.emptyList();
    }

    /**
     * Copy of a nested map with its keys as strings, empty for anything else
     */
    public static Map<String, Object> map(Object value) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((key, entry) -> copy.put(String.valueOf(key), entry));
        }
        return copy;
    }

    public static String joined(Object value) {
        if (value instanceof Collection) {
            return ((Collection<?>) value).stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
        return value == null ? "" : String.valueOf(value);
    }
}
