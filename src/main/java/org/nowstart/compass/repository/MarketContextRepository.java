package org.nowstart.compass.repository;

import java.util.Optional;
import org.nowstart.compass.data.entity.MarketContext;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MarketContextRepository extends JpaRepository<MarketContext, String> {

    Optional<MarketContext> findTopByContextIdOrderByAsOfDesc(String contextId);
}
