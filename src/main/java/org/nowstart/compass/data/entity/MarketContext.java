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
 * Stored market snapshot. The full snapshot lives in {@code payload} as JSON.
 */
@Entity
@Immutable
@Getter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class MarketContext extends AppendOnlyRecord<String> {

    @Id
    private String recordKey;

    private String contextId;

    private Instant asOf;

    private String source;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Override
    public String getId() {
        return recordKey;
    }
}
