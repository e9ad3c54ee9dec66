package de.mirkosertic.mcp.reranklearn.feedback;

/**
 * Raised for a malformed feedback event. Such an event never enters the buffer.
 */
public class InvalidFeedbackException extends IllegalArgumentException {

    public InvalidFeedbackException(final String message) {
        super(message);
    }
}
