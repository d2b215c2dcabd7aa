package teranet.mapdev.preprocess.datetime;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Date;

/**
 * Runtime classification of a table cell.
 *
 * Cells arrive with heterogeneous types; every per-cell rule branches on this
 * kind before attempting any parse or format.
 */
public enum CellKind {

    /** null, or a floating point NaN */
    MISSING,

    /** a native date/time value that needs no text parsing */
    TEMPORAL,

    /** a number, treated as seconds since the epoch */
    NUMERIC,

    /** anything else, parsed through its string form */
    TEXT;

    public static CellKind of(Object value) {
        if (value == null) {
            return MISSING;
        }
        if (value instanceof Double && ((Double) value).isNaN()) {
            return MISSING;
        }
        if (value instanceof Float && ((Float) value).isNaN()) {
            return MISSING;
        }
        if (value instanceof Number) {
            return NUMERIC;
        }
        if (value instanceof Instant
                || value instanceof LocalDateTime
                || value instanceof LocalDate
                || value instanceof ZonedDateTime
                || value instanceof OffsetDateTime
                || value instanceof Date) {
            return TEMPORAL;
        }
        return TEXT;
    }
}
