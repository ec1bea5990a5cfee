package org.nowstart.compass.data.dto;

import java.time.Instant;
import org.nowstart.compass.data.entity.UserProfile;
import org.nowstart.compass.data.type.RiskTolerance;

public record UserProfileDto(
        String userId,
        String cohort,
        RiskTolerance riskTolerance,
        double maxDrawdownTolerance,
        double lossAversionScore,
        boolean explainableOnly,
        Instant createdAt
) {

    public static UserProfileDto from(UserProfile profile) {
        return new UserProfileDto(
                profile.getUserId(),
                profile.getCohort(),
                profile.getRiskTolerance(),
                profile.getMaxDrawdownTolerance(),
                profile.getLossAversionScore(),
                profile.isExplainableOnly(),
                profile.getCreatedAt()
        );
    }
}
