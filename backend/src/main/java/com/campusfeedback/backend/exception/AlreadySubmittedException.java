package com.campusfeedback.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class AlreadySubmittedException extends BizException {

    public AlreadySubmittedException(String message) {
        super("ALREADY_SUBMITTED", message);
    }
}
