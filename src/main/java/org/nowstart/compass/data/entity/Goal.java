package org.nowstart.compass.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import java.math.BigDecimal;
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
public class Goal extends AppendOnlyRecord<String> {

    @Id
    private String recordKey;

    private String goalId;

    private int version;

    private String userId;

    @Column(length = 1000)
    private String description;

    @Column(precision = 38, scale = 2)
    private BigDecimal targetAmount;

    private int horizonMonths;

    private double maxDrawdownTolerance;

    public static String key(String goalId, int version) {
        return goalId + "@" + version;
    }

    @Override
    public String getId() {
        return recordKey;
    }
}
