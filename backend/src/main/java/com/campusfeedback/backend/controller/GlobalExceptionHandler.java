package com.campusfeedback.backend.controller;

import com.campusfeedback.backend.dto.ApiError;
import com.campusfeedback.backend.exception.BizException;
import com.campusfeedback.backend.exception.InconsistentDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.servlet.resource.NoResourceFoundException;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String GENERIC_ERROR_MESSAGE = "Something went wrong while processing the request.";

    @ExceptionHandler(BizException.class)
    public ResponseEntity<ApiError> handleBizException(BizException ex) {
        ResponseStatus annotated = AnnotatedElementUtils.findMergedAnnotation(ex.getClass(), ResponseStatus.class);
        HttpStatus status = annotated != null ? annotated.code() : HttpStatus.BAD_REQUEST;
        log.info("Request rejected with {} {}: {}", status.value(), ex.getCode(), ex.getMessage());
        return ResponseEntity.status(status).body(ApiError.fail(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleInvalidParameters(HandlerMethodValidationException ex) {
        String message = ex.getAllValidationResults().stream()
                .flatMap(result -> result.getResolvableErrors().stream())
                .map(MessageSourceResolvable::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.info("Invalid request parameters: {}", message);
        return ResponseEntity.badRequest().body(ApiError.fail("INVALID_REQUEST", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.info("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ApiError.fail("INVALID_REQUEST", "Responses must be an object where keys are question IDs and values are responses."));
    }

    @ExceptionHandler({
            HttpMediaTypeNotSupportedException.class,
            HttpRequestMethodNotSupportedException.class,
            MissingServletRequestParameterException.class,
            NoResourceFoundException.class
    })
    public ResponseEntity<ApiError> handleFrameworkClientError(Exception ex) {
        ErrorResponse errorResponse = (ErrorResponse) ex;
        HttpStatusCode status = errorResponse.getStatusCode();
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String code = resolved != null ? resolved.name() : "INVALID_REQUEST";
        String message = errorResponse.getBody().getDetail() != null ? errorResponse.getBody().getDetail() : ex.getMessage();
        log.info("Request rejected with {}: {}", status.value(), message);
        return ResponseEntity.status(status)
                .headers(errorResponse.getHeaders())
                .body(ApiError.fail(code, message));
    }

    @ExceptionHandler(InconsistentDataException.class)
    public ResponseEntity<ApiError> handleInconsistentData(InconsistentDataException ex) {
        log.error("Data integrity violation", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.error("DATA_INTEGRITY", GENERIC_ERROR_MESSAGE));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.error("INTERNAL_ERROR", GENERIC_ERROR_MESSAGE));
    }
}
