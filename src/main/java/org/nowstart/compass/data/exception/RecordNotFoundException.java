package org.nowstart.compass.data.exception;

import org.springframework.http.HttpStatus;

/**
 * Unknown entity, or an entity owned by another user. Both look the same to the caller.
 */
public class RecordNotFoundException extends CompassException {

    public RecordNotFoundException(String entityType, String entityId, String entityVersion) {
        super(
                HttpStatus.NOT_FOUND,
                "not_found",
                entityType + " not found: " + entityId + (entityVersion == null ? "" : "@" + entityVersion),
                entityId,
                entityVersion
        );
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
