package org.nowstart.compass.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import java.time.Instant;
import java.util.UUID;
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
public class UserFeedback extends AppendOnlyRecord<UUID> {

    @Id
    private UUID feedbackId;

    private String decisionId;

    private String userId;

    private int rating;

    @Column(length = 2000)
    private String comment;

    private Instant submittedAt;

    @Override
    public UUID getId() {
        return feedbackId;
    }
}
