package org.nowstart.compass.repository;

import java.util.Optional;
import org.nowstart.compass.data.entity.Decision;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DecisionRepository extends JpaRepository<Decision, String> {

    Optional<Decision> findByStrategyKey(String strategyKey);
}
