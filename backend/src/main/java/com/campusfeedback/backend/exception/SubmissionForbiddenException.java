package com.campusfeedback.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The form exists but does not accept submissions right now (not active, or past its end date).
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class SubmissionForbiddenException extends BizException {

    public SubmissionForbiddenException(String code, String message) {
        super(code, message);
    }
}
