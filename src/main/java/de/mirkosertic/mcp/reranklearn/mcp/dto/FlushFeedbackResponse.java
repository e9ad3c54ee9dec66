package de.mirkosertic.mcp.reranklearn.mcp.dto;

/**
 * Response DTO for the flushFeedback tool.
 */
public record FlushFeedbackResponse(
        boolean success,
        Integer flushedEvents,
        Long completedFlushCycles,
        String error
) {
    public static FlushFeedbackResponse success(final int flushedEvents, final long completedFlushCycles) {
        return new FlushFeedbackResponse(true, flushedEvents, completedFlushCycles, null);
    }

    public static FlushFeedbackResponse error(final String errorMessage) {
        return new FlushFeedbackResponse(false, null, null, errorMessage);
    }
}
