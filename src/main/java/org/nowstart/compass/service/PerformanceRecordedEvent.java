package org.nowstart.compass.service;

import java.time.Instant;

/**
 * Published inside the evaluating transaction; handled once it has committed.
 */
public record PerformanceRecordedEvent(
        String traceId,
        String strategyFamily,
        String userCohort,
        Instant asOf
) {
}
