package com.campusfeedback.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Stored data is missing something the submission flow relies on (a grant without a
 * respondent, a form without an allocation...). Points at corrupted upstream data, not at
 * bad client input, so the caller only ever sees a generic 500.
 */
@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class InconsistentDataException extends RuntimeException {

    public InconsistentDataException(String message) {
        super(message);
    }
}
