package org.nowstart.compass.repository;

import java.util.Optional;
import org.nowstart.compass.data.entity.ExecutionTrace;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ExecutionTraceRepository extends JpaRepository<ExecutionTrace, String> {

    Optional<ExecutionTrace> findByDecisionId(String decisionId);
}
