package org.nowstart.compass.repository;

import java.util.List;
import java.util.Optional;
import org.nowstart.compass.data.entity.StrategyRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StrategyRecordRepository extends JpaRepository<StrategyRecord, String> {

    Optional<StrategyRecord> findTopByStrategyIdOrderByVersionDesc(String strategyId);

    List<StrategyRecord> findByStrategyIdOrderByVersionAsc(String strategyId);
}
