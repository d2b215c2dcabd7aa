package teranet.mapdev.preprocess.formatter;

import teranet.mapdev.preprocess.metadata.Metadata;
import teranet.mapdev.preprocess.model.DataTable;

/**
 * No-operation formatter that passes data through unchanged.
 *
 * This is the formatter handed out by the factory when:
 * - the requested name is null or blank
 * - the requested name is not registered
 * - the requested formatter is disabled by configuration
 * - the registered formatter cannot be created
 */
public class NoOpFormatter implements Formatter {

    private boolean fitted;

    @Override
    public void fit(Metadata metadata) {
        // Nothing to learn, metadata is left untouched
        fitted = true;
    }

    @Override
    public DataTable convert(DataTable rawData) {
        return rawData;
    }

    @Override
    public DataTable reverseConvert(DataTable processedData) {
        return processedData;
    }

    @Override
    public boolean isFitted() {
        return fitted;
    }
}
