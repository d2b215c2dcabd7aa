package teranet.mapdev.preprocess.datetime;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;

/**
 * Backward per-cell rule: seconds since the epoch -> formatted datetime string.
 *
 * Every result is either a string rendered with the column format or
 * {@link #NO_DATETIME}. Negative timestamps are outside the accepted range and
 * also render as {@link #NO_DATETIME}, so they cannot be told apart from
 * missing values after reconstruction.
 */
@Slf4j
public class TimestampRenderer {

    public static final String NO_DATETIME = "No Datetime";

    public static final long MIN_TIMESTAMP = 0L;

    /** 9999-12-31T23:59:59Z */
    public static final long MAX_TIMESTAMP = 253402300799L;

    private static final long MICROS_PER_SECOND = 1_000_000L;

    private final ZoneId zone;
    private final StrftimePattern pattern;
    private final String compileError;

    public TimestampRenderer(String format, ZoneId zone) {
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
     * Render one cell.
     *
     * @param value cell value, expected to be a number of seconds
     * @return formatted datetime, or {@link #NO_DATETIME}
     */
    public String toDatetime(Object value) {
        CellKind kind = CellKind.of(value);
        if (kind == CellKind.MISSING) {
            return NO_DATETIME;
        }
        if (kind != CellKind.NUMERIC) {
            log.debug("Error converting timestamp to str: unsupported value type {}",
                    value.getClass().getSimpleName());
            return NO_DATETIME;
        }
        double seconds = ((Number) value).doubleValue();
        if (!isInRange(seconds)) {
            return NO_DATETIME;
        }
        if (pattern == null) {
            log.debug("Error converting timestamp to str: {}", compileError);
            return NO_DATETIME;
        }
        try {
            return pattern.format(toLocalDateTime(seconds));
        } catch (RuntimeException e) {
            log.debug("Error converting timestamp to str: {}", e.getMessage());
            return NO_DATETIME;
        }
    }

    /**
     * @return true if the timestamp is inside [{@link #MIN_TIMESTAMP}, {@link #MAX_TIMESTAMP}];
     *         NaN and infinities are not
     */
    public static boolean isInRange(double seconds) {
        return seconds >= MIN_TIMESTAMP && seconds <= MAX_TIMESTAMP;
    }

    private LocalDateTime toLocalDateTime(double seconds) {
        long whole = (long) Math.floor(seconds);
        long micros = Math.round((seconds - whole) * MICROS_PER_SECOND);
        if (micros >= MICROS_PER_SECOND) {
            whole++;
            micros -= MICROS_PER_SECOND;
        }
        Instant instant = Instant.ofEpochSecond(whole, micros * 1_000L);
        return LocalDateTime.ofInstant(instant, zone);
    }
}
