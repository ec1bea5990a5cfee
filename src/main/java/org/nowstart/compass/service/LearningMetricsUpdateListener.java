package org.nowstart.compass.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.data.type.LearningScope;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Recomputes the family and cohort metrics touched by a committed evaluation. A recompute that
 * loses a race is left to the next scheduled sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LearningMetricsUpdateListener {

    private final LearningMetricsService learningMetricsService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onPerformanceRecorded(PerformanceRecordedEvent event) {
        recompute(LearningScope.STRATEGY_FAMILY, event.strategyFamily(), event);
        recompute(LearningScope.USER_COHORT, event.userCohort(), event);
    }

    private void recompute(LearningScope scopeType, String scopeKey, PerformanceRecordedEvent event) {
        if (scopeKey == null) {
            return;
        }
        try {
            learningMetricsService.recompute(scopeType, scopeKey, event.asOf());
        } catch (ConcurrentRecordModificationException exception) {
            log.warn(
                    "event=learning_metrics_recompute_deferred scope={} key={} trace_id={} as_of={} reason=\"{}\"",
                    scopeType,
                    scopeKey,
                    event.traceId(),
                    event.asOf(),
                    exception.getMessage()
            );
        }
    }
}
