package teranet.mapdev.preprocess.datetime;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Forward per-cell rule: cell value -> seconds since the epoch.
 *
 * The result is either a timestamp or null, the missing-value marker.
 * A cell that cannot be converted is logged and becomes null; no exception
 * leaves {@link #toTimestamp(Object)}.
 */
@Slf4j
public class TimestampParser {

    private static final double MICROS_PER_SECOND = 1_000_000d;

    private final String format;
    private final ZoneId zone;
    private final StrftimePattern pattern;
    private final String compileError;

    /**
     * @param format column datetime format, compiled once here
     * @param zone   zone used for values without an offset
     */
    public TimestampParser(String format, ZoneId zone) {
        this.format = format;
        this.zone = zone;
        StrftimePattern compiled = null;
        String error = null;
        try {
            compiled = StrftimePattern.compile(format);
        } catch (IllegalArgumentException e) {
            error = e.getMessage();
        }
        this.pattern = compiled;
        this.compileError = error;
    }

    /**
     * Convert one cell.
     *
     * @param value cell value of any type
     * @return epoch seconds with microsecond precision, or null for missing / unconvertible cells
     */
    public Double toTimestamp(Object value) {
        switch (CellKind.of(value)) {
            case MISSING:
                return null;
            case NUMERIC:
                // already a timestamp
                return ((Number) value).doubleValue();
            case TEMPORAL:
                return epochSeconds(toInstant(value));
            default:
                return parseText(value);
        }
    }

    private Double parseText(Object value) {
        if (pattern == null) {
            warn(value, compileError);
            return null;
        }
        try {
            LocalDateTime parsed = pattern.parse(value.toString());
            return epochSeconds(parsed.atZone(zone).toInstant());
        } catch (RuntimeException e) {
            warn(value, e.getMessage());
            return null;
        }
    }

    private void warn(Object value, String reason) {
        log.warn("Error converting '{}' ({}) to timestamp with format '{}': {}. Value will be set as missing",
                value, value.getClass().getSimpleName(), format, reason);
    }

    private Instant toInstant(Object value) {
        if (value instanceof Instant) {
            return (Instant) value;
        }
        if (value instanceof ZonedDateTime) {
            return ((ZonedDateTime) value).toInstant();
        }
        if (value instanceof OffsetDateTime) {
            return ((OffsetDateTime) value).toInstant();
        }
        if (value instanceof LocalDateTime) {
            return ((LocalDateTime) value).atZone(zone).toInstant();
        }
        if (value instanceof LocalDate) {
            return ((LocalDate) value).atStartOfDay(zone).toInstant();
        }
        // java.sql.Date does not support toInstant()
        return Instant.ofEpochMilli(((Date) value).getTime());
    }

    static double epochSeconds(Instant instant) {
        long micros = instant.getNano() / 1_000;
        return instant.getEpochSecond() + micros / MICROS_PER_SECOND;
    }
}
