package org.nowstart.compass.data.exception;

import org.springframework.http.HttpStatus;

/**
 * A write targeted a version that is no longer the head, or lost a race for the next one.
 * The caller re-reads and retries.
 */
public class ConcurrentRecordModificationException extends CompassException {

    public ConcurrentRecordModificationException(String entityId, String entityVersion, String message) {
        super(HttpStatus.CONFLICT, "concurrent_modification", message, entityId, entityVersion);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
