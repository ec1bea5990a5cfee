package org.nowstart.compass.data.exception;

import org.springframework.http.HttpStatus;

public class InvalidTransitionException extends CompassException {

    public InvalidTransitionException(String entityId, String entityVersion, String message) {
        super(HttpStatus.CONFLICT, "invalid_transition", message, entityId, entityVersion);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
