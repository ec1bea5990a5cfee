package org.nowstart.compass.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ExecutionTrace extends AppendOnlyRecord<String> {

    @Id
    private String traceId;

    @Column(unique = true)
    private String decisionId;

    private String originDecisionId;

    private String strategyKey;

    private String strategyFamily;

    private String userId;

    private Instant startedAt;

    @Override
    public String getId() {
        return traceId;
    }
}
