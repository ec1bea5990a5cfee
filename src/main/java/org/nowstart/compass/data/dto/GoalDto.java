package org.nowstart.compass.data.dto;

import java.math.BigDecimal;
import java.time.Instant;
import org.nowstart.compass.data.entity.Goal;

public record GoalDto(
        String goalId,
        int version,
        String userId,
        String description,
        BigDecimal targetAmount,
        int horizonMonths,
        double maxDrawdownTolerance,
        Instant createdAt
) {

    public static GoalDto from(Goal goal) {
        return new GoalDto(
                goal.getGoalId(),
                goal.getVersion(),
                goal.getUserId(),
                goal.getDescription(),
                goal.getTargetAmount(),
                goal.getHorizonMonths(),
                goal.getMaxDrawdownTolerance(),
                goal.getCreatedAt()
        );
    }
}
