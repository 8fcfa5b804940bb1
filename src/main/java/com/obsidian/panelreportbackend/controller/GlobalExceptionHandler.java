package com.obsidian.panelreportbackend.controller;

import com.obsidian.panelreportbackend.dto.ErrorResponse;
import com.obsidian.panelreportbackend.exception.NotFoundException;
import com.obsidian.panelreportbackend.exception.PanelBatchException;
import com.obsidian.panelreportbackend.exception.PanelDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(PanelBatchException.class)
    public ResponseEntity<ErrorResponse> handleBatchFailure(PanelBatchException ex) {
        log.error("Report batch failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, ex.getCode(), "Failed to fetch data for the selected panels", ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getCode(), ex.getMessage(), null);
    }

    @ExceptionHandler(PanelDataException.class)
    public ResponseEntity<ErrorResponse> handlePanelDataException(PanelDataException ex) {
        log.error("Monitoring backend error", ex);
        return respond(HttpStatus.BAD_GATEWAY, ex.getCode(), ex.getMessage(), null);
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_SERVER_ERROR",
                "An unexpected error occurred", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, String code, String message, String details) {
        ErrorResponse error = ErrorResponse.builder()
                .code(code)
                .message(message)
                .details(details)
                .build();
        return ResponseEntity.status(status).body(error);
    }
}
