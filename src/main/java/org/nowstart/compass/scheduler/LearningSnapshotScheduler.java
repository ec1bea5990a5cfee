package org.nowstart.compass.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.service.LearningMetricsService;
import org.nowstart.compass.service.LearningSnapshotProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class LearningSnapshotScheduler {

    private final LearningMetricsService learningMetricsService;
    private final LearningSnapshotProvider learningSnapshotProvider;

    @Scheduled(fixedDelayString = "${compass.learning.refresh-interval:30s}")
    public void run() {
        for (LearningMetricsService.ScopeWindow scope : learningMetricsService.recentScopes()) {
            try {
                learningMetricsService.recompute(scope.scopeType(), scope.scopeKey(), scope.windowStart());
            } catch (ConcurrentRecordModificationException exception) {
                log.warn(
                        "event=learning_metrics_sweep_conflict scope={} key={} window_start={} reason=\"{}\"",
                        scope.scopeType(),
                        scope.scopeKey(),
                        scope.windowStart(),
                        exception.getMessage()
                );
            }
        }
        learningSnapshotProvider.refresh();
    }
}
