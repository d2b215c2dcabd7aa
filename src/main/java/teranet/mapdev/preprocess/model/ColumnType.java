package teranet.mapdev.preprocess.model;

/**
 * Column type classifications tracked by the pipeline metadata.
 */
public enum ColumnType {
    DISCRETE("discrete"),
    DATETIME("datetime"),
    FLOAT("float");

    private final String value;

    ColumnType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
