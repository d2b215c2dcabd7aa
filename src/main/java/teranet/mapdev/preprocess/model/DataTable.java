package teranet.mapdev.preprocess.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, column-oriented table handed between pipeline stages.
 *
 * Columns keep their insertion order. Cells are heterogeneous: a cell may be
 * null (missing), a String, a java.time value, a java.util.Date or a Number.
 *
 * Every "mutating" method returns a new table; the receiver is never changed,
 * so the same instance can be read by several formatters.
 */
public final class DataTable {

    private final Map<String, List<Object>> columns;
    private final int rowCount;

    private DataTable(Map<String, List<Object>> columns, int rowCount) {
        this.columns = columns;
        this.rowCount = rowCount;
    }

    /**
     * Create a table from an ordered column map.
     *
     * @param columns column name -> cell values (null cells allowed)
     * @return new table holding defensive copies of the column lists
     * @throws IllegalArgumentException if the columns differ in length
     */
    public static DataTable of(Map<String, ? extends List<?>> columns) {
        Objects.requireNonNull(columns, "columns");
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        int rows = -1;
        for (Map.Entry<String, ? extends List<?>> entry : columns.entrySet()) {
            List<Object> values = copyOf(entry.getValue());
            if (rows >= 0 && values.size() != rows) {
                throw new IllegalArgumentException(String.format(
                        "Column %s has %d rows, expected %d", entry.getKey(), values.size(), rows));
            }
            rows = values.size();
            copy.put(entry.getKey(), values);
        }
        return new DataTable(Collections.unmodifiableMap(copy), Math.max(rows, 0));
    }

    public static DataTable empty() {
        return new DataTable(Collections.emptyMap(), 0);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getColumnNames() {
        return new ArrayList<>(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Get the cells of a column.
     *
     * @param name column name
     * @return unmodifiable view of the cells
     * @throws IllegalArgumentException if the column does not exist
     */
    public List<Object> getColumn(String name) {
        List<Object> values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown column: " + name);
        }
        return values;
    }

    public Object getValue(String column, int row) {
        return getColumn(column).get(row);
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columns.size();
    }

    /**
     * Return a copy of this table with one column replaced (or appended if absent).
     */
    public DataTable withColumn(String name, List<?> values) {
        Map<String, List<Object>> copy = new LinkedHashMap<>(columns);
        copy.put(name, new ArrayList<>(Objects.requireNonNull(values, "values")));
        return of(copy);
    }

    /**
     * Return a copy of this table without the named columns.
     * Names that are not present are ignored.
     */
    public DataTable withoutColumns(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            return this;
        }
        Set<String> present = columns.keySet();
        if (Collections.disjoint(present, names)) {
            return this;
        }
        Map<String, List<Object>> copy = new LinkedHashMap<>(columns);
        copy.keySet().removeAll(names);
        return new DataTable(Collections.unmodifiableMap(copy), copy.isEmpty() ? 0 : rowCount);
    }

    private static List<Object> copyOf(List<?> values) {
        if (values == null) {
            return Collections.emptyList();
        }
        // List.copyOf rejects nulls, and null is the missing-value marker
        return Collections.unmodifiableList(new ArrayList<>(values));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DataTable)) {
            return false;
        }
        DataTable other = (DataTable) o;
        return rowCount == other.rowCount
                && new ArrayList<>(columns.keySet()).equals(new ArrayList<>(other.columns.keySet()))
                && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rowCount);
    }

    @Override
    public String toString() {
        return "DataTable{columns=" + columns.keySet() + ", rows=" + rowCount + "}";
    }

    /**
     * Fluent builder keeping column order.
     */
    public static final class Builder {

        private final Map<String, List<?>> columns = new LinkedHashMap<>();

        public Builder column(String name, List<?> values) {
            columns.put(name, values);
            return this;
        }

        public Builder column(String name, Object... values) {
            columns.put(name, Arrays.asList(values));
            return this;
        }

        public DataTable build() {
            return DataTable.of(columns);
        }
    }
}
