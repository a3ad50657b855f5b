package com.pagesmith.orchestrator.api;

import com.pagesmith.orchestrator.api.dto.ErrorResponse;
import com.pagesmith.orchestrator.model.ErrorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(TaskRejectedException.class)
    public ResponseEntity<ErrorResponse> rejected(TaskRejectedException e) {
        log.warn("Rejected submission ({}): {}", e.status().value(), e.getMessage());
        return ResponseEntity.status(e.status())
                .body(new ErrorResponse(e.kind(), e.getMessage(), Instant.now()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> unreadable(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ErrorResponse(ErrorKind.VALIDATION_ERROR.wireName(),
                        "Request body is not valid JSON", Instant.now()));
    }
}
