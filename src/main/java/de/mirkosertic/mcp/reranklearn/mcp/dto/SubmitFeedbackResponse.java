package de.mirkosertic.mcp.reranklearn.mcp.dto;

/**
 * Response DTO for the submitFeedback tool.
 */
public record SubmitFeedbackResponse(
        boolean success,
        String message,
        Integer pendingFeedback,
        String error
) {
    public static SubmitFeedbackResponse success(final int pendingFeedback) {
        return new SubmitFeedbackResponse(true, "Feedback collected", pendingFeedback, null);
    }

    public static SubmitFeedbackResponse error(final String errorMessage) {
        return new SubmitFeedbackResponse(false, null, null, errorMessage);
    }
}
