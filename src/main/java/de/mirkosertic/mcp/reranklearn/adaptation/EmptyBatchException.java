package de.mirkosertic.mcp.reranklearn.adaptation;

/**
 * An adaptation rule was invoked without any usable samples.
 */
public class EmptyBatchException extends IllegalStateException {

    public EmptyBatchException(final String message) {
        super(message);
    }
}
