package com.optionsterminal.exception;

import java.util.List;
import java.util.Map;

public class InvalidOrderLegException extends BaseException {

    public InvalidOrderLegException(List<String> missingFields) {
        super(
                ErrorCode.VALIDATION_ERROR,
                "Order leg is missing required field(s): " + String.join(", ", missingFields),
                Map.of("missingFields", missingFields));
    }

    public InvalidOrderLegException(String reason) {
        super(ErrorCode.VALIDATION_ERROR, reason);
    }
}
