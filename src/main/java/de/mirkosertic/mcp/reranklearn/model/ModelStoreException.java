package de.mirkosertic.mcp.reranklearn.model;

import java.io.IOException;

/**
 * The persistence medium behind the model store could not be read or written.
 */
public class ModelStoreException extends IOException {

    public ModelStoreException(final String message) {
        super(message);
    }

    public ModelStoreException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
