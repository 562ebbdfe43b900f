package io.mnemo.core.feedback;

public record MemoryFeedback(
    String id,
    String sessionId,
    String queryId,
    String atomId,
    FeedbackType feedback,
    String note,
    long createdAt
) {
}
