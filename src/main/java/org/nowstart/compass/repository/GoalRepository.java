package org.nowstart.compass.repository;

import java.util.Optional;
import org.nowstart.compass.data.entity.Goal;
import org.springframework.data.jpa.repository.JpaRepository;

public interface GoalRepository extends JpaRepository<Goal, String> {

    Optional<Goal> findTopByGoalIdOrderByVersionDesc(String goalId);

    Optional<Goal> findByGoalIdAndVersion(String goalId, int version);
}
