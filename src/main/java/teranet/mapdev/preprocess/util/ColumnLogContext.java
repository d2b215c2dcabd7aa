package teranet.mapdev.preprocess.util;

import org.slf4j.MDC;

/**
 * Tags log lines with the column a formatter is working on.
 * Add %X{column} to the logging pattern to print it.
 */
public final class ColumnLogContext {

    public static final String COLUMN_KEY = "column";

    private ColumnLogContext() {
    }

    public static void setColumn(String column) {
        MDC.put(COLUMN_KEY, column);
    }

    /**
     * MDC is thread-local, call this in a finally block.
     */
    public static void clearColumn() {
        MDC.remove(COLUMN_KEY);
    }
}
