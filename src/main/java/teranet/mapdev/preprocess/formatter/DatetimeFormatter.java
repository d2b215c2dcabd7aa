package teranet.mapdev.preprocess.formatter;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.preprocess.datetime.TimestampParser;
import teranet.mapdev.preprocess.datetime.TimestampRenderer;
import teranet.mapdev.preprocess.dto.DatetimeFormatterState;
import teranet.mapdev.preprocess.metadata.Metadata;
import teranet.mapdev.preprocess.model.ColumnType;
import teranet.mapdev.preprocess.model.DataTable;
import teranet.mapdev.preprocess.util.ColumnLogContext;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Formatter for datetime columns.
 *
 * Transformations applied:
 * 1. fit: columns classified as datetime that have a format become "datetime columns",
 *    the others become "dead columns" and are removed from the metadata
 * 2. convert: dead columns are dropped, datetime cells become epoch seconds (Double):
 *    - missing -> null
 *    - java.time / java.util.Date values -> converted directly
 *    - numbers -> kept, they are timestamps already
 *    - text -> parsed with the column format, unparseable -> null
 * 3. reverseConvert: epoch seconds are rendered with the column format,
 *    - missing, out of [0, 253402300799] or unrenderable -> "No Datetime"
 *
 * convert returns its input as is only when fit found no datetime columns at all. If every
 * datetime column turned out dead, those columns are still dropped, so a column without a
 * format never reaches the output. reverseConvert returns its input whenever there are no
 * usable datetime columns.
 *
 * Values without an offset are interpreted in the zone given at construction.
 *
 * Not thread-safe: fit once, then convert / reverseConvert from one thread.
 */
@Slf4j
public class DatetimeFormatter implements Formatter {

    public static final String NAME = "DatetimeFormatter";

    private final ZoneId zone;

    private List<String> datetimeColumns = new ArrayList<>();
    private Map<String, String> datetimeFormats = new LinkedHashMap<>();
    private List<String> deadColumns = new ArrayList<>();
    private boolean fitted;

    public DatetimeFormatter() {
        this(ZoneOffset.UTC);
    }

    public DatetimeFormatter(ZoneId zone) {
        this.zone = zone;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void initialize() {
        log.info("DatetimeFormatter initialized (zone: {})", zone);
    }

    @Override
    public void fit(Metadata metadata) {
        Map<String, String> formats = new LinkedHashMap<>(metadata.getDatetimeFormat());
        List<String> usable = new ArrayList<>();
        List<String> dead = new ArrayList<>();

        // Columns without a format are too risky to guess, drop them
        for (String column : metadata.getDatetimeColumns()) {
            String format = formats.get(column);
            if (format != null && !format.isEmpty()) {
                usable.add(column);
            } else {
                dead.add(column);
                log.warn("Column {} has no datetime format, DatetimeFormatter will REMOVE this column!", column);
            }
        }

        // Skip when some columns are no longer discrete (already re-typed by an earlier fit)
        Set<String> notDiscrete = new HashSet<>(usable);
        notDiscrete.removeAll(metadata.getDiscreteColumns());
        if (notDiscrete.isEmpty()) {
            metadata.changeColumnType(usable, ColumnType.DISCRETE, ColumnType.DATETIME);
        } else {
            log.debug("Columns {} are not discrete, skipping column type change", notDiscrete);
        }
        metadata.removeColumns(dead);

        this.datetimeFormats = formats;
        this.datetimeColumns = usable;
        this.deadColumns = dead;
        this.fitted = true;
        log.info("DatetimeFormatter fitted: {} datetime columns, {} dead columns", usable.size(), dead.size());
    }

    @Override
    public DataTable convert(DataTable rawData) {
        if (datetimeColumns.isEmpty() && deadColumns.isEmpty()) {
            log.info("Converting data using DatetimeFormatter... Finished (No datetime columns).");
            return rawData;
        }

        DataTable result = rawData;
        for (String column : deadColumns) {
            if (result.hasColumn(column)) {
                result = removeColumns(result, Collections.singletonList(column));
                log.warn("Column {} was removed because lack of format info.", column);
            }
        }
        if (datetimeColumns.isEmpty()) {
            log.info("Converting data using DatetimeFormatter... Finished (No datetime columns).");
            return result;
        }

        log.info("Converting data using DatetimeFormatter...");
        for (String column : datetimeColumns) {
            if (!result.hasColumn(column)) {
                log.warn("Column {} not in raw data's column list, skipping", column);
                continue;
            }
            ColumnLogContext.setColumn(column);
            try {
                TimestampParser parser = new TimestampParser(getFormat(column), zone);
                List<Object> values = result.getColumn(column);
                List<Object> converted = new ArrayList<>(values.size());
                for (Object value : values) {
                    converted.add(parser.toTimestamp(value));
                }
                result = result.withColumn(column, converted);
            } finally {
                ColumnLogContext.clearColumn();
            }
        }
        log.info("Converting data using DatetimeFormatter... Finished.");
        return result;
    }

    @Override
    public DataTable reverseConvert(DataTable processedData) {
        if (datetimeColumns.isEmpty()) {
            log.info("Data reverse-converted by DatetimeFormatter (No datetime columns).");
            return processedData;
        }

        log.info("Data reverse-converting by DatetimeFormatter...");
        log.debug("Parameters: {}, {}", datetimeColumns, datetimeFormats);

        DataTable result = processedData;
        for (String column : datetimeColumns) {
            if (!result.hasColumn(column)) {
                log.error("Column {} not in processed data's column list!", column);
                continue;
            }
            ColumnLogContext.setColumn(column);
            try {
                TimestampRenderer renderer = new TimestampRenderer(getFormat(column), zone);
                List<Object> values = result.getColumn(column);
                List<Object> rendered = new ArrayList<>(values.size());
                for (Object value : values) {
                    rendered.add(renderer.toDatetime(value));
                }
                result = result.withColumn(column, rendered);
            } finally {
                ColumnLogContext.clearColumn();
            }
        }
        log.info("Data reverse-converted by DatetimeFormatter... Finished.");
        return result;
    }

    @Override
    public boolean isFitted() {
        return fitted;
    }

    /**
     * @return the column format, or "" if none was recorded
     */
    public String getFormat(String column) {
        return datetimeFormats.getOrDefault(column, "");
    }

    public List<String> getDatetimeColumns() {
        return Collections.unmodifiableList(datetimeColumns);
    }

    public Map<String, String> getDatetimeFormats() {
        return Collections.unmodifiableMap(datetimeFormats);
    }

    public List<String> getDeadColumns() {
        return Collections.unmodifiableList(deadColumns);
    }

    public ZoneId getZone() {
        return zone;
    }

    /**
     * Snapshot the fitted state for persistence.
     */
    public DatetimeFormatterState toState() {
        return new DatetimeFormatterState(
                new ArrayList<>(datetimeColumns),
                new LinkedHashMap<>(datetimeFormats),
                new ArrayList<>(deadColumns),
                fitted);
    }

    /**
     * Rebuild a formatter from persisted state, without touching any metadata.
     */
    public static DatetimeFormatter fromState(DatetimeFormatterState state, ZoneId zone) {
        DatetimeFormatter formatter = new DatetimeFormatter(zone);
        if (state.getDatetimeColumns() != null) {
            formatter.datetimeColumns = new ArrayList<>(state.getDatetimeColumns());
        }
        if (state.getDatetimeFormats() != null) {
            formatter.datetimeFormats = new LinkedHashMap<>(state.getDatetimeFormats());
        }
        if (state.getDeadColumns() != null) {
            formatter.deadColumns = new ArrayList<>(state.getDeadColumns());
        }
        formatter.fitted = state.isFitted();
        return formatter;
    }
}
