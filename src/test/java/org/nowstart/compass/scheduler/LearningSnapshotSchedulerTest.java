package org.nowstart.compass.scheduler;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.data.type.LearningScope;
import org.nowstart.compass.service.LearningMetricsService;
import org.nowstart.compass.service.LearningSnapshotProvider;

class LearningSnapshotSchedulerTest {

    private static final Instant WINDOW = Instant.parse("2024-06-16T00:00:00Z");

    @Test
    void run_recomputesRecentScopesThenRefreshesSnapshot() {
        LearningMetricsService learningMetricsService = mock(LearningMetricsService.class);
        LearningSnapshotProvider learningSnapshotProvider = mock(LearningSnapshotProvider.class);
        when(learningMetricsService.recentScopes()).thenReturn(List.of(
                new LearningMetricsService.ScopeWindow(LearningScope.STRATEGY_FAMILY, "signal_weighted", WINDOW),
                new LearningMetricsService.ScopeWindow(LearningScope.USER_COHORT, "cohort-a", WINDOW)
        ));
        LearningSnapshotScheduler scheduler = new LearningSnapshotScheduler(learningMetricsService, learningSnapshotProvider);

        scheduler.run();

        InOrder order = inOrder(learningMetricsService, learningSnapshotProvider);
        order.verify(learningMetricsService).recompute(LearningScope.STRATEGY_FAMILY, "signal_weighted", WINDOW);
        order.verify(learningMetricsService).recompute(LearningScope.USER_COHORT, "cohort-a", WINDOW);
        order.verify(learningSnapshotProvider).refresh();
    }

    @Test
    void run_refreshesEvenWhenScopeConflicts() {
        LearningMetricsService learningMetricsService = mock(LearningMetricsService.class);
        LearningSnapshotProvider learningSnapshotProvider = mock(LearningSnapshotProvider.class);
        when(learningMetricsService.recentScopes()).thenReturn(List.of(
                new LearningMetricsService.ScopeWindow(LearningScope.STRATEGY_FAMILY, "signal_weighted", WINDOW)
        ));
        when(learningMetricsService.recompute(LearningScope.STRATEGY_FAMILY, "signal_weighted", WINDOW))
                .thenThrow(new ConcurrentRecordModificationException("STRATEGY_FAMILY:signal_weighted", "3", "written concurrently"));
        LearningSnapshotScheduler scheduler = new LearningSnapshotScheduler(learningMetricsService, learningSnapshotProvider);

        scheduler.run();

        verify(learningSnapshotProvider).refresh();
    }
}
