package org.nowstart.compass.data.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;
import org.nowstart.compass.data.type.RiskTolerance;

@Entity
@Immutable
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class UserProfile extends AppendOnlyRecord<String> {

    @Id
    private String userId;

    private String cohort;

    @Enumerated(EnumType.STRING)
    private RiskTolerance riskTolerance;

    private double maxDrawdownTolerance;

    private double lossAversionScore;

    private boolean explainableOnly;

    @Override
    public String getId() {
        return userId;
    }
}
