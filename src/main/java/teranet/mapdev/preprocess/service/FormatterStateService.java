package teranet.mapdev.preprocess.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import teranet.mapdev.preprocess.config.DatetimeFormatterConfig;
import teranet.mapdev.preprocess.dto.DatetimeFormatterState;
import teranet.mapdev.preprocess.formatter.DatetimeFormatter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves and restores fitted datetime formatters as JSON documents,
 * so a pipeline can fit once and convert / reverse-convert in later runs.
 */
@Service
public class FormatterStateService {

    private static final Logger logger = LoggerFactory.getLogger(FormatterStateService.class);

    private final DatetimeFormatterConfig config;
    private final ObjectMapper objectMapper;

    public FormatterStateService(DatetimeFormatterConfig config) {
        this.config = config;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Serialize a formatter's fitted state.
     */
    public String toJson(DatetimeFormatter formatter) {
        try {
            return objectMapper.writeValueAsString(formatter.toState());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize DatetimeFormatter state", e);
        }
    }

    /**
     * Restore a formatter from JSON, using the configured zone.
     */
    public DatetimeFormatter fromJson(String json) {
        try {
            DatetimeFormatterState state = objectMapper.readValue(json, DatetimeFormatterState.class);
            return DatetimeFormatter.fromState(state, config.resolveZone());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to read DatetimeFormatter state", e);
        }
    }

    /**
     * Write a formatter's state to a file, creating parent folders if needed.
     */
    public void write(DatetimeFormatter formatter, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(file.toFile(), formatter.toState());
            logger.info("Saved DatetimeFormatter state to {}", file);
        } catch (IOException e) {
            logger.error("Failed to save DatetimeFormatter state to {}", file, e);
            throw new UncheckedIOException("Failed to save DatetimeFormatter state to " + file, e);
        }
    }

    /**
     * Read a formatter's state from a file.
     */
    public DatetimeFormatter read(Path file) {
        try {
            DatetimeFormatterState state = objectMapper.readValue(file.toFile(), DatetimeFormatterState.class);
            logger.info("Loaded DatetimeFormatter state from {}: {} datetime columns",
                    file, state.getDatetimeColumns() == null ? 0 : state.getDatetimeColumns().size());
            return DatetimeFormatter.fromState(state, config.resolveZone());
        } catch (IOException e) {
            logger.error("Failed to load DatetimeFormatter state from {}", file, e);
            throw new UncheckedIOException("Failed to load DatetimeFormatter state from " + file, e);
        }
    }
}
