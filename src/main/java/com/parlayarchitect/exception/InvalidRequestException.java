package com.parlayarchitect.exception;

import java.util.Map;

/**
 * Raised by request validation. The selection service converts it into an INVALID_REQUEST
 * rejection; it never escapes to the caller.
 */
public class InvalidRequestException extends BaseException {

    public InvalidRequestException(String message) {
        super(ErrorCode.INVALID_REQUEST, message);
    }

    public InvalidRequestException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_REQUEST, message, details);
    }
}
