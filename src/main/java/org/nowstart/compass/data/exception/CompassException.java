package org.nowstart.compass.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Typed failure raised at a component boundary.
 *
 * <p>Carries the id and version of the entity the failure refers to so the caller can re-issue a
 * corrected request.
 */
@Getter
public abstract class CompassException extends RuntimeException {

    private final HttpStatus status;
    private final String code;
    private final String entityId;
    private final String entityVersion;

    protected CompassException(HttpStatus status, String code, String message, String entityId, String entityVersion) {
        super(message);
        this.status = status;
        this.code = code;
        this.entityId = entityId;
        this.entityVersion = entityVersion;
    }

    public abstract boolean isRetryable();
}
