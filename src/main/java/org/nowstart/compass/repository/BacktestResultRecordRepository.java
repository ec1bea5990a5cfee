package org.nowstart.compass.repository;

import org.nowstart.compass.data.entity.BacktestResultRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BacktestResultRecordRepository extends JpaRepository<BacktestResultRecord, String> {
}
