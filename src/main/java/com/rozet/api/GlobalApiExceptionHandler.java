package com.rozet.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.util.StringUtils;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_MESSAGE_LENGTH = 300;

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleValidation(MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("HTTP_ERROR path={}, errorType={}, errorMessage={}", request.getRequestURI(),
                ex.getClass().getSimpleName(), message);
        return new ErrorResponse("validation_failed", message);
    }

    @ExceptionHandler({
            BindException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleBadRequest(Exception ex, HttpServletRequest request) {
        String message = truncate(StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : "Illegal parameter");
        log.warn("HTTP_ERROR path={}, errorType={}, errorMessage={}", request.getRequestURI(),
                ex.getClass().getSimpleName(), message);
        return new ErrorResponse("bad_request", message);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, errorType={}, errorMessage={}", request.getRequestURI(),
                ex.getClass().getSimpleName(), truncate(ex.getMessage()), ex);
        return new ErrorResponse("internal_error", "Unexpected server error");
    }

    private String truncate(String text) {
        if (text == null || text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH);
    }
}
