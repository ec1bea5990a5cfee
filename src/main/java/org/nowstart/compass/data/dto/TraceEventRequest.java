package org.nowstart.compass.data.dto;

import java.util.Map;

/**
 * An event to append to an execution trace.
 *
 * @param payload              broker-side details, stored as-is
 * @param compensatesSequence  action being corrected; only for compensations
 * @param expectedLastSequence when set, the append only succeeds if this is still the last sequence
 */
public record TraceEventRequest(
        Map<String, Object> payload,
        Integer compensatesSequence,
        Integer expectedLastSequence
) {
}
