package com.campusfeedback.backend.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class ResourceNotFoundException extends BizException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message);
    }
}
