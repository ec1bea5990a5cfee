package org.nowstart.compass.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.compass.data.dto.ExecutionEventDto;
import org.nowstart.compass.data.dto.ExecutionTraceDto;
import org.nowstart.compass.data.dto.TraceEventRequest;
import org.nowstart.compass.data.entity.Decision;
import org.nowstart.compass.data.entity.ExecutionEvent;
import org.nowstart.compass.data.entity.ExecutionTrace;
import org.nowstart.compass.data.exception.ConcurrentRecordModificationException;
import org.nowstart.compass.data.exception.InvalidTransitionException;
import org.nowstart.compass.data.exception.RecordNotFoundException;
import org.nowstart.compass.data.type.ExecutionEventType;
import org.nowstart.compass.repository.ExecutionEventRepository;
import org.nowstart.compass.repository.ExecutionTraceRepository;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Execution traces and their append-only event logs.
 *
 * <p>Sequence numbers start at 1 and are dense. Once a completion has been appended only
 * compensations are accepted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionTraceService {

    private final ExecutionTraceRepository executionTraceRepository;
    private final ExecutionEventRepository executionEventRepository;
    private final JsonPayloadMapper jsonPayloadMapper;
    private final Clock clock;

    /**
     * Creates the single, empty trace of an accepted decision.
     */
    @Transactional
    public ExecutionTrace start(Decision decision, String originDecisionId) {
        ExecutionTrace trace = ExecutionTrace.builder()
                .traceId(UUID.randomUUID().toString())
                .decisionId(decision.getDecisionId())
                .originDecisionId(originDecisionId)
                .strategyKey(decision.getStrategyKey())
                .strategyFamily(decision.getStrategyFamily())
                .userId(decision.getUserId())
                .startedAt(clock.instant())
                .build();
        try {
            executionTraceRepository.saveAndFlush(trace);
        } catch (DataIntegrityViolationException exception) {
            throw new InvalidTransitionException(decision.getDecisionId(), null, "Decision " + decision.getDecisionId() + " already has an execution trace");
        }
        log.info(
                "event=execution_trace_started trace_id={} decision_id={} origin_decision_id={} strategy={}",
                trace.getTraceId(),
                trace.getDecisionId(),
                originDecisionId,
                trace.getStrategyKey()
        );
        return trace;
    }

    @Transactional
    public ExecutionTraceDto appendAction(String userId, String traceId, TraceEventRequest request) {
        return append(userId, traceId, ExecutionEventType.ACTION, request);
    }

    @Transactional
    public ExecutionTraceDto appendCompensation(String userId, String traceId, TraceEventRequest request) {
        return append(userId, traceId, ExecutionEventType.COMPENSATION, request);
    }

    @Transactional
    public ExecutionTraceDto complete(String userId, String traceId, TraceEventRequest request) {
        return append(userId, traceId, ExecutionEventType.COMPLETION, request);
    }

    public ExecutionTraceDto get(String userId, String traceId) {
        ExecutionTrace trace = getScoped(userId, traceId);
        return toDto(trace, executionEventRepository.findByTraceIdOrderBySequenceAsc(traceId));
    }

    public ExecutionTrace getScoped(String userId, String traceId) {
        return executionTraceRepository.findById(traceId)
                .filter(trace -> trace.getUserId().equals(userId))
                .orElseThrow(() -> new RecordNotFoundException("ExecutionTrace", traceId, null));
    }

    public Optional<ExecutionTrace> findByDecision(String decisionId) {
        return executionTraceRepository.findByDecisionId(decisionId);
    }

    private ExecutionTraceDto append(String userId, String traceId, ExecutionEventType type, TraceEventRequest request) {
        ExecutionTrace trace = getScoped(userId, traceId);
        TraceEventRequest event = request == null ? new TraceEventRequest(null, null, null) : request;
        List<ExecutionEvent> events = executionEventRepository.findByTraceIdOrderBySequenceAsc(traceId);
        int lastSequence = events.isEmpty() ? 0 : events.get(events.size() - 1).getSequence();

        if (event.expectedLastSequence() != null && event.expectedLastSequence() != lastSequence) {
            throw new ConcurrentRecordModificationException(
                    traceId,
                    String.valueOf(lastSequence),
                    "Trace " + traceId + " is at sequence " + lastSequence + ", expected " + event.expectedLastSequence()
            );
        }

        boolean completed = events.stream().anyMatch(existing -> existing.getType() == ExecutionEventType.COMPLETION);
        if (type != ExecutionEventType.COMPENSATION && completed) {
            throw new InvalidTransitionException(traceId, String.valueOf(lastSequence), "Trace " + traceId + " is completed; only compensations can be appended");
        }
        if (type == ExecutionEventType.COMPENSATION) {
            validateCompensation(traceId, events, event.compensatesSequence());
        }

        int sequence = lastSequence + 1;
        ExecutionEvent appended = ExecutionEvent.builder()
                .eventKey(ExecutionEvent.key(traceId, sequence))
                .traceId(traceId)
                .sequence(sequence)
                .type(type)
                .payload(jsonPayloadMapper.write(event.payload() == null ? Map.of() : event.payload()))
                .compensatesSequence(type == ExecutionEventType.COMPENSATION ? event.compensatesSequence() : null)
                .recordedAt(clock.instant())
                .build();
        try {
            executionEventRepository.saveAndFlush(appended);
        } catch (DataIntegrityViolationException exception) {
            throw new ConcurrentRecordModificationException(
                    traceId,
                    String.valueOf(lastSequence),
                    "Sequence " + sequence + " of trace " + traceId + " was appended concurrently"
            );
        }
        log.info(
                "event=execution_event_appended trace_id={} sequence={} type={} compensates={}",
                traceId,
                sequence,
                type,
                appended.getCompensatesSequence()
        );

        List<ExecutionEvent> updated = new ArrayList<>(events);
        updated.add(appended);
        return toDto(trace, updated);
    }

    private void validateCompensation(String traceId, List<ExecutionEvent> events, Integer compensatesSequence) {
        if (compensatesSequence == null) {
            throw new IllegalArgumentException("compensatesSequence is required for a compensation");
        }
        ExecutionEvent target = events.stream()
                .filter(existing -> existing.getSequence() == compensatesSequence)
                .findFirst()
                .orElseThrow(() -> new RecordNotFoundException("ExecutionEvent", traceId, String.valueOf(compensatesSequence)));
        if (target.getType() != ExecutionEventType.ACTION) {
            throw new InvalidTransitionException(traceId, String.valueOf(compensatesSequence), "Only actions can be compensated, sequence " + compensatesSequence + " is a " + target.getType());
        }
        boolean alreadyCompensated = events.stream()
                .anyMatch(existing -> existing.getType() == ExecutionEventType.COMPENSATION
                        && compensatesSequence.equals(existing.getCompensatesSequence()));
        if (alreadyCompensated) {
            throw new InvalidTransitionException(traceId, String.valueOf(compensatesSequence), "Action " + compensatesSequence + " of trace " + traceId + " is already compensated");
        }
    }

    private ExecutionTraceDto toDto(ExecutionTrace trace, List<ExecutionEvent> events) {
        Instant completedAt = events.stream()
                .filter(event -> event.getType() == ExecutionEventType.COMPLETION)
                .map(ExecutionEvent::getRecordedAt)
                .findFirst()
                .orElse(null);
        List<ExecutionEventDto> eventDtos = events.stream()
                .map(event -> new ExecutionEventDto(
                        event.getSequence(),
                        event.getType(),
                        jsonPayloadMapper.readMap(event.getPayload()),
                        event.getCompensatesSequence(),
                        event.getRecordedAt()
                ))
                .toList();
        return new ExecutionTraceDto(
                trace.getTraceId(),
                trace.getDecisionId(),
                trace.getOriginDecisionId(),
                trace.getStrategyKey(),
                trace.getStrategyFamily(),
                trace.getStartedAt(),
                completedAt,
                eventDtos
        );
    }
}
