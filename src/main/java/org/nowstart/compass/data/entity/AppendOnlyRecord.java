package org.nowstart.compass.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;
import java.time.Instant;
import lombok.Getter;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.domain.Persistable;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

/**
 * Base of every record that is written once and never updated.
 *
 * <p>Records are always reported as new until they have been persisted or loaded, so saving one
 * is an insert: a second write under an existing key fails with a constraint violation instead of
 * being merged over the first.
 */
@Getter
@MappedSuperclass
@EntityListeners(AuditingEntityListener.class)
public abstract class AppendOnlyRecord<ID> implements Persistable<ID> {

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;

    @Transient
    private boolean stored;

    @Override
    public boolean isNew() {
        return !stored;
    }

    @PostLoad
    @PostPersist
    void markStored() {
        this.stored = true;
    }
}
