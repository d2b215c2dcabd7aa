package teranet.mapdev.preprocess.metadata;

/**
 * Thrown when a metadata update is inconsistent with the current classification,
 * for example moving a column out of a type it does not belong to.
 */
public class MetadataException extends RuntimeException {

    public MetadataException(String message) {
        super(message);
    }
}
