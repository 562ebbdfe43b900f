package io.mnemo.core.feedback;

public record FeedbackRequest(
    String sessionId,
    String queryId,
    String atomId,
    FeedbackType feedback,
    String note
) {
    public FeedbackRequest {
        if (atomId == null || atomId.isBlank()) {
            throw new IllegalArgumentException("atomId must not be blank");
        }
        if (feedback == null) {
            throw new IllegalArgumentException("feedback must not be null");
        }
        sessionId = sessionId == null ? "" : sessionId;
        queryId = queryId == null ? "" : queryId;
    }
}
