package teranet.mapdev.preprocess.formatter;

import teranet.mapdev.preprocess.metadata.Metadata;
import teranet.mapdev.preprocess.model.DataTable;

import java.util.Collection;

/**
 * Interface for column formatters in the preprocessing pipeline.
 *
 * The pipeline driver calls {@link #fit(Metadata)} once, then any number of
 * {@link #convert(DataTable)} calls before model training and
 * {@link #reverseConvert(DataTable)} calls on generated data.
 *
 * Implementations are created by name through
 * {@link teranet.mapdev.preprocess.service.FormatterFactory}.
 *
 * Contract for implementations:
 * - convert and reverseConvert never modify their input table
 * - convert and reverseConvert do not throw for bad cell values; failures
 *   are absorbed into the returned data and logged
 */
public interface Formatter {

    /**
     * Learn which columns this formatter handles and update the metadata accordingly.
     *
     * @param metadata dataset metadata, may be modified
     */
    void fit(Metadata metadata);

    /**
     * Transform raw data into the model-facing representation.
     *
     * @param rawData unprocessed table
     * @return transformed table (may be the same instance when nothing changes)
     */
    DataTable convert(DataTable rawData);

    /**
     * Transform generated data back into the raw representation.
     *
     * @param processedData generated table
     * @return restored table (may be the same instance when nothing changes)
     */
    DataTable reverseConvert(DataTable processedData);

    /**
     * @return true once {@link #fit(Metadata)} has completed
     */
    boolean isFitted();

    /**
     * Remove columns from a table. Absent columns are ignored.
     */
    default DataTable removeColumns(DataTable data, Collection<String> columns) {
        return data.withoutColumns(columns);
    }

    /**
     * Name under which the formatter is registered.
     */
    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Called once by the factory after construction.
     */
    default void initialize() {
        // Default: no initialization needed
    }
}
