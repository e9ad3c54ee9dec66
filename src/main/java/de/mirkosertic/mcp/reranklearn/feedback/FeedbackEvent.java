package de.mirkosertic.mcp.reranklearn.feedback;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A single relevance observation for one search result, supplied by a user or an automated judge.
 * <p>
 * Validated on construction: an instance that exists is always well-formed.
 */
public record FeedbackEvent(
        /** The query that produced the result. */
        String query,
        /** Identifier of the rated result. */
        String resultId,
        /** Relevance in [0,1], 1 being highly relevant. */
        double relevanceScore,
        /** When the feedback was given. */
        Instant timestamp,
        /** Optional identifier of the rating user. */
        @Nullable String userId
) {

    public FeedbackEvent {
        if (query == null || query.isBlank()) {
            throw new InvalidFeedbackException("query must not be blank");
        }
        if (resultId == null || resultId.isBlank()) {
            throw new InvalidFeedbackException("resultId must not be blank");
        }
        if (Double.isNaN(relevanceScore) || relevanceScore < 0.0 || relevanceScore > 1.0) {
            throw new InvalidFeedbackException("relevanceScore must be within [0,1], was " + relevanceScore);
        }
        if (timestamp == null) {
            throw new InvalidFeedbackException("timestamp must not be null");
        }
    }

    public static FeedbackEvent of(final String query, final String resultId, final double relevanceScore) {
        return new FeedbackEvent(query, resultId, relevanceScore, Instant.now(), null);
    }

    public boolean isPositive(final double positiveThreshold) {
        return relevanceScore >= positiveThreshold;
    }
}
