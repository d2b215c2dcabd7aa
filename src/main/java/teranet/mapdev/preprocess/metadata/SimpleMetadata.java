package teranet.mapdev.preprocess.metadata;

import lombok.extern.slf4j.Slf4j;
import teranet.mapdev.preprocess.model.ColumnType;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * In-memory {@link Metadata} keeping one ordered column set per {@link ColumnType}.
 *
 * Sets may overlap: a text column holding dates is usually both discrete and
 * datetime until a formatter claims it with {@link #changeColumnType}.
 * Accessors return unmodifiable snapshots.
 */
@Slf4j
public class SimpleMetadata implements Metadata {

    private final Map<ColumnType, Set<String>> columnsByType = new EnumMap<>(ColumnType.class);
    private final Map<String, String> datetimeFormat = new LinkedHashMap<>();

    public SimpleMetadata() {
        for (ColumnType type : ColumnType.values()) {
            columnsByType.put(type, new LinkedHashSet<>());
        }
    }

    /**
     * Add a column to a type classification, keeping any other classification it has.
     */
    public SimpleMetadata addColumn(String column, ColumnType type) {
        columnsByType.get(type).add(column);
        return this;
    }

    public SimpleMetadata setDatetimeFormat(String column, String format) {
        datetimeFormat.put(column, format);
        return this;
    }

    public Set<String> getColumns(ColumnType type) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(columnsByType.get(type)));
    }

    /**
     * @return every classified column, in type order then insertion order
     */
    public Set<String> getColumnList() {
        Set<String> all = new LinkedHashSet<>();
        columnsByType.values().forEach(all::addAll);
        return Collections.unmodifiableSet(all);
    }

    @Override
    public Map<String, String> getDatetimeFormat() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(datetimeFormat));
    }

    @Override
    public Set<String> getDatetimeColumns() {
        return getColumns(ColumnType.DATETIME);
    }

    @Override
    public Set<String> getDiscreteColumns() {
        return getColumns(ColumnType.DISCRETE);
    }

    @Override
    public void changeColumnType(Collection<String> columns, ColumnType from, ColumnType to) {
        Set<String> source = columnsByType.get(from);
        for (String column : columns) {
            if (!source.contains(column)) {
                throw new MetadataException(String.format(
                        "Column %s is not of type %s, cannot change it to %s",
                        column, from.getValue(), to.getValue()));
            }
        }
        for (String column : columns) {
            source.remove(column);
            columnsByType.get(to).add(column);
        }
        log.debug("Changed column type of {} from {} to {}", columns, from.getValue(), to.getValue());
    }

    @Override
    public void removeColumns(Collection<String> columns) {
        for (String column : columns) {
            columnsByType.values().forEach(set -> set.remove(column));
            datetimeFormat.remove(column);
        }
        if (!columns.isEmpty()) {
            log.debug("Removed columns from metadata: {}", columns);
        }
    }
}
