package org.nowstart.compass.data.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
public class DataInsufficientException extends CompassException {

    private final int requiredBars;
    private final int availableBars;

    public DataInsufficientException(String contextId, String asOf, int requiredBars, int availableBars, String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "data_insufficient", message, contextId, asOf);
        this.requiredBars = requiredBars;
        this.availableBars = availableBars;
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
