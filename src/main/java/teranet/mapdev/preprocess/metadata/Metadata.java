package teranet.mapdev.preprocess.metadata;

import teranet.mapdev.preprocess.model.ColumnType;

import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Per-dataset column metadata consumed by formatters during fit.
 *
 * Formatters read the type classification and per-column datetime formats,
 * then report back which columns they re-typed and which must be dropped.
 */
public interface Metadata {

    /**
     * @return column name -> strftime-style datetime format (e.g. "%Y-%m-%d")
     */
    Map<String, String> getDatetimeFormat();

    /**
     * @return columns classified as datetime
     */
    Set<String> getDatetimeColumns();

    /**
     * @return columns classified as discrete / categorical
     */
    Set<String> getDiscreteColumns();

    /**
     * Move columns from one type classification to another.
     *
     * @param columns columns to move
     * @param from    current classification
     * @param to      new classification
     */
    void changeColumnType(Collection<String> columns, ColumnType from, ColumnType to);

    /**
     * Remove columns from every classification and from the format mapping.
     *
     * @param columns columns to drop, absent names are ignored
     */
    void removeColumns(Collection<String> columns);
}
