package com.talentledger.api.controller;

import com.talentledger.api.dto.ErrorBody;
import com.talentledger.ingestion.ledger.InvalidReferenceException;
import com.talentledger.ingestion.ledger.UnreachableSourceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps ledger failures on synchronous read paths to ErrorBody responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(UnreachableSourceException.class)
    public ResponseEntity<ErrorBody> handleUnreachable(UnreachableSourceException ex) {
        log.warn("Ledger unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("SOURCE_UNAVAILABLE", "Ledger is temporarily unavailable"));
    }

    @ExceptionHandler(InvalidReferenceException.class)
    public ResponseEntity<ErrorBody> handleInvalidReference(InvalidReferenceException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("NOT_FOUND", ex.getMessage()));
    }
}
