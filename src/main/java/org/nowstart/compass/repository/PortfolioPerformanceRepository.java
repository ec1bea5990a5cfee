package org.nowstart.compass.repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.nowstart.compass.data.entity.PortfolioPerformance;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PortfolioPerformanceRepository extends JpaRepository<PortfolioPerformance, UUID> {

    List<PortfolioPerformance> findByTraceIdOrderByAsOfAsc(String traceId);

    List<PortfolioPerformance> findByStrategyFamilyAndAsOfGreaterThanEqualAndAsOfLessThan(
            String strategyFamily,
            Instant from,
            Instant to
    );

    List<PortfolioPerformance> findByUserCohortAndAsOfGreaterThanEqualAndAsOfLessThan(
            String userCohort,
            Instant from,
            Instant to
    );

    List<PortfolioPerformance> findByAsOfGreaterThanEqual(Instant from);
}
