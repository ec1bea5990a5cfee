package org.nowstart.compass.repository;

import java.util.List;
import org.nowstart.compass.data.entity.DecisionResolution;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DecisionResolutionRepository extends JpaRepository<DecisionResolution, String> {

    List<DecisionResolution> findByStrategyFamilyOrderByDecidedAtDesc(String strategyFamily, Pageable pageable);

    List<DecisionResolution> findByUserIdOrderByDecidedAtDesc(String userId, Pageable pageable);
}
