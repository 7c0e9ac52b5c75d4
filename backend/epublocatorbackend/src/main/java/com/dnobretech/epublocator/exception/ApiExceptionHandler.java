package com.dnobretech.epublocator.exception;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    // 400 - EPUB ilegível/corrompido
    @ExceptionHandler(StagingFailureException.class)
    public ResponseEntity<ApiError> handleStaging(StagingFailureException ex, HttpServletRequest req) {
        log.warn("[api] staging falhou: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex, req);
    }

    // 422 - EPUB legível mas estruturalmente inválido (container, OPF, spine, documento)
    @ExceptionHandler(EpubLocateException.class)
    public ResponseEntity<ApiError> handleLocate(EpubLocateException ex, HttpServletRequest req) {
        log.warn("[api] {}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, ex, req);
    }

    // 400 - argumentos inválidos em geral (ex.: query vazia)
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex, req);
    }

    // 400 - @NotEmpty etc. em params
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiError> handleConstraintViolation(ConstraintViolationException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex, req);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiError> handleMethodValidation(HandlerMethodValidationException ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex, req);
    }

    // 400 - faltou o arquivo ou a query
    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ApiError> handleMissing(Exception ex, HttpServletRequest req) {
        return error(HttpStatus.BAD_REQUEST, ex, req);
    }

    // 413
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex, HttpServletRequest req) {
        return error(HttpStatus.PAYLOAD_TOO_LARGE, ex, req);
    }

    // 500 - fallback único
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Erro não tratado", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex, req);
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ApiError(status.value(), status.getReasonPhrase(), ex.getClass().getSimpleName(),
                        ex.getMessage(), req.getRequestURI(), Instant.now()));
    }
}
