package org.nowstart.compass.data.dto;

import java.time.Instant;
import java.util.UUID;
import org.nowstart.compass.data.entity.UserFeedback;

public record FeedbackDto(
        UUID feedbackId,
        String decisionId,
        int rating,
        String comment,
        Instant submittedAt
) {

    public static FeedbackDto from(UserFeedback feedback) {
        return new FeedbackDto(
                feedback.getFeedbackId(),
                feedback.getDecisionId(),
                feedback.getRating(),
                feedback.getComment(),
                feedback.getSubmittedAt()
        );
    }
}
