package teranet.mapdev.preprocess.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import teranet.mapdev.preprocess.config.DatetimeFormatterConfig;
import teranet.mapdev.preprocess.formatter.DatetimeFormatter;
import teranet.mapdev.preprocess.formatter.Formatter;
import teranet.mapdev.preprocess.formatter.NoOpFormatter;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Factory service for creating Formatter instances by registered name.
 *
 * This service:
 * - Keeps a registry of formatter names -> constructors
 * - Creates a NEW instance per call (formatters hold fitted state)
 * - Handles errors gracefully (falls back to NoOpFormatter)
 * - Initializes formatters before handing them out
 */
@Service
@Slf4j
public class FormatterFactory {

    private final DatetimeFormatterConfig datetimeConfig;

    // Registry: formatter name -> constructor
    private final Map<String, Supplier<? extends Formatter>> registry = new ConcurrentHashMap<>();

    public FormatterFactory(DatetimeFormatterConfig datetimeConfig) {
        this.datetimeConfig = datetimeConfig;
        register(DatetimeFormatter.NAME, () -> new DatetimeFormatter(datetimeConfig.resolveZone()));
        register("NoOpFormatter", NoOpFormatter::new);
    }

    /**
     * Register (or replace) a formatter constructor.
     *
     * @param name     formatter name used by the pipeline configuration
     * @param supplier creates a fresh, unfitted formatter
     */
    public void register(String name, Supplier<? extends Formatter> supplier) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Formatter name must not be blank");
        }
        if (registry.put(name.trim(), supplier) != null) {
            log.info("Replaced formatter registration: {}", name);
        } else {
            log.debug("Registered formatter: {}", name);
        }
    }

    /**
     * Create a formatter.
     *
     * The formatter is determined by:
     * 1. Look up the name in the registry
     * 2. Check the formatter is enabled in configuration
     * 3. Create and initialize a new instance
     * 4. Return NoOpFormatter if any step fails
     *
     * @param name registered formatter name
     * @return Formatter instance (never null)
     */
    public Formatter create(String name) {
        if (name == null || name.trim().isEmpty()) {
            log.debug("No formatter name provided, using NoOpFormatter");
            return new NoOpFormatter();
        }

        String key = name.trim();
        Supplier<? extends Formatter> supplier = registry.get(key);
        if (supplier == null) {
            log.warn("Formatter not registered: {}. Using NoOpFormatter.", key);
            return new NoOpFormatter();
        }

        if (DatetimeFormatter.NAME.equals(key) && !datetimeConfig.isEnabled()) {
            log.debug("DatetimeFormatter disabled by configuration, using NoOpFormatter");
            return new NoOpFormatter();
        }

        try {
            Formatter formatter = supplier.get();
            formatter.initialize();
            log.debug("Created formatter: {}", key);
            return formatter;
        } catch (Exception e) {
            log.error("Error creating formatter: {}. Using NoOpFormatter.", key, e);
        }
        return new NoOpFormatter();
    }

    /**
     * @return registered formatter names, sorted
     */
    public List<String> registeredNames() {
        List<String> names = new ArrayList<>(registry.keySet());
        names.sort(String::compareTo);
        return names;
    }
}
