package org.nowstart.compass.repository;

import java.util.Optional;
import java.util.UUID;
import org.nowstart.compass.data.entity.UserFeedback;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserFeedbackRepository extends JpaRepository<UserFeedback, UUID> {

    Optional<UserFeedback> findTopByDecisionIdOrderBySubmittedAtDesc(String decisionId);
}
