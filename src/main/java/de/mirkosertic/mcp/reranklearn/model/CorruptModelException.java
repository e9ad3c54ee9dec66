package de.mirkosertic.mcp.reranklearn.model;

/**
 * A stored model version exists but cannot be deserialized.
 */
public class CorruptModelException extends ModelStoreException {

    public CorruptModelException(final String message) {
        super(message);
    }

    public CorruptModelException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
