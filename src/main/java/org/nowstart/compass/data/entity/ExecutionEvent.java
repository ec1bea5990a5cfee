package org.nowstart.compass.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.nowstart.compass.data.type.ExecutionEventType;

/**
 * One entry of an execution trace's log, keyed {@code traceId#sequence}.
 */
@Entity
@Immutable
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExecutionEvent extends AppendOnlyRecord<String> {

    @Id
    private String eventKey;

    private String traceId;

    private int sequence;

    @Enumerated(EnumType.STRING)
    private ExecutionEventType type;

    @Column(columnDefinition = "TEXT")
    private String payload;

    private Integer compensatesSequence;

    private Instant recordedAt;

    public static String key(String traceId, int sequence) {
        return traceId + "#" + sequence;
    }

    @Override
    public String getId() {
        return eventKey;
    }
}
