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

/**
 * A proposed decision. Its terminal outcome is a separate {@link DecisionResolution} record.
 */
@Entity
@Immutable
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Decision extends AppendOnlyRecord<String> {

    @Id
    private String decisionId;

    @Column(unique = true)
    private String strategyKey;

    private String strategyId;

    private int strategyVersion;

    private String strategyFamily;

    private String userId;

    private String parentDecisionId;

    private Instant proposedAt;

    @Override
    public String getId() {
        return decisionId;
    }
}
