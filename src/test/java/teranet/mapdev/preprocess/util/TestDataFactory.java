package teranet.mapdev.preprocess.util;

import teranet.mapdev.preprocess.metadata.SimpleMetadata;
import teranet.mapdev.preprocess.model.ColumnType;
import teranet.mapdev.preprocess.model.DataTable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;

/**
 * Utility class for creating test data.
 * Provides reusable fixtures for tables and metadata.
 */
public class TestDataFactory {

    public static final String DATE_FORMAT = "%Y-%m-%d";
    public static final String DATETIME_FORMAT = "%Y-%m-%d %H:%M:%S";

    /**
     * Epoch seconds of a UTC calendar date.
     */
    public static double ts(int year, int month, int day) {
        return LocalDate.of(year, month, day).atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }

    /**
     * Epoch seconds of a UTC date-time.
     */
    public static double ts(int year, int month, int day, int hour, int minute, int second) {
        return LocalDateTime.of(year, month, day, hour, minute, second).toEpochSecond(ZoneOffset.UTC);
    }

    /**
     * Metadata for an orders dataset:
     * - order_date: datetime + discrete, format %Y-%m-%d
     * - shipped_at: datetime + discrete, format %Y-%m-%d %H:%M:%S
     * - legacy_date: datetime without a format (dead column)
     * - customer: discrete
     * - amount: float
     */
    public static SimpleMetadata createOrdersMetadata() {
        return new SimpleMetadata()
                .addColumn("order_date", ColumnType.DATETIME)
                .addColumn("order_date", ColumnType.DISCRETE)
                .addColumn("shipped_at", ColumnType.DATETIME)
                .addColumn("shipped_at", ColumnType.DISCRETE)
                .addColumn("legacy_date", ColumnType.DATETIME)
                .addColumn("legacy_date", ColumnType.DISCRETE)
                .addColumn("customer", ColumnType.DISCRETE)
                .addColumn("amount", ColumnType.FLOAT)
                .setDatetimeFormat("order_date", DATE_FORMAT)
                .setDatetimeFormat("shipped_at", DATETIME_FORMAT);
    }

    /**
     * Orders table matching {@link #createOrdersMetadata()}.
     */
    public static DataTable createOrdersTable() {
        return DataTable.builder()
                .column("order_date", "2023-01-01", "invalid", "1992-05-15")
                .column("shipped_at", "2023-01-02 08:30:00", null, "1992-05-16 17:05:59")
                .column("legacy_date", "01/02/2023", "03/04/2023", "05/06/2023")
                .column("customer", "John Doe", "Jane Smith", "Bob Johnson")
                .column("amount", Arrays.asList(1200.00, 25.50, 75.00))
                .build();
    }

    /**
     * Metadata without any datetime columns.
     */
    public static SimpleMetadata createPlainMetadata() {
        return new SimpleMetadata()
                .addColumn("customer", ColumnType.DISCRETE)
                .addColumn("amount", ColumnType.FLOAT);
    }
}
