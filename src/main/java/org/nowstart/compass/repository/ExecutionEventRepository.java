package org.nowstart.compass.repository;

import java.util.List;
import org.nowstart.compass.data.entity.ExecutionEvent;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ExecutionEventRepository extends JpaRepository<ExecutionEvent, String> {

    List<ExecutionEvent> findByTraceIdOrderBySequenceAsc(String traceId);
}
