package org.nowstart.compass.data.entity;

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
import org.nowstart.compass.data.type.DecisionOutcome;

/**
 * The one terminal transition of a decision, keyed by the decision id.
 */
@Entity
@Immutable
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class DecisionResolution extends AppendOnlyRecord<String> {

    @Id
    private String decisionId;

    @Enumerated(EnumType.STRING)
    private DecisionOutcome outcome;

    private String userId;

    private String strategyFamily;

    private String modifiedStrategyKey;

    private String reasonCode;

    private Instant decidedAt;

    @Override
    public String getId() {
        return decisionId;
    }
}
