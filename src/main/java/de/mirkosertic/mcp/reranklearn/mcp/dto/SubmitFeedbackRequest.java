package de.mirkosertic.mcp.reranklearn.mcp.dto;

import de.mirkosertic.mcp.reranklearn.feedback.FeedbackEvent;
import de.mirkosertic.mcp.reranklearn.feedback.InvalidFeedbackException;
import de.mirkosertic.mcp.reranklearn.mcp.ToolParam;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Request DTO for the submitFeedback tool.
 */
public record SubmitFeedbackRequest(
        @ToolParam("The search query that produced the rated result.")
        String query,

        @ToolParam("Identifier of the rated search result.")
        String resultId,

        @ToolParam(value = "Relevance of the result for the query, 0 = irrelevant, 1 = highly relevant.",
                minimum = 0.0, maximum = 1.0)
        Double relevanceScore,

        @Nullable
        @ToolParam("ISO-8601 instant when the feedback was given. Defaults to now.")
        String timestamp,

        @Nullable
        @ToolParam("Optional identifier of the rating user.")
        String userId
) {

    public static SubmitFeedbackRequest fromMap(final Map<String, Object> args) {
        final Object score = args.get("relevanceScore");
        return new SubmitFeedbackRequest(
                asString(args.get("query")),
                asString(args.get("resultId")),
                score instanceof Number number ? number.doubleValue() : null,
                asString(args.get("timestamp")),
                asString(args.get("userId")));
    }

    private static String asString(final Object value) {
        return value != null ? value.toString() : null;
    }

    /**
     * Validate and convert into a feedback event.
     *
     * @throws InvalidFeedbackException if a field is missing or out of range
     */
    public FeedbackEvent toFeedbackEvent() {
        if (relevanceScore == null) {
            throw new InvalidFeedbackException("relevanceScore is required");
        }
        final Instant when;
        if (timestamp == null || timestamp.isBlank()) {
            when = Instant.now();
        } else {
            try {
                when = Instant.parse(timestamp.trim());
            } catch (final DateTimeParseException e) {
                throw new InvalidFeedbackException("timestamp is not an ISO-8601 instant: " + timestamp);
            }
        }
        return new FeedbackEvent(query, resultId, relevanceScore, when, userId);
    }
}
