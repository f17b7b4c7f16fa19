package com.example.mltranslation.controller;

import com.example.mltranslation.exception.BusinessRuleException;
import com.example.mltranslation.exception.ExternalIdConflictException;
import com.example.mltranslation.exception.InsufficientFundsException;
import com.example.mltranslation.exception.InvalidCredentialsException;
import com.example.mltranslation.exception.TaskPublishException;
import com.example.mltranslation.exception.TranslationFailedException;
import com.example.mltranslation.exception.UserAlreadyExistsException;
import com.example.mltranslation.exception.UserNotFoundException;
import com.example.mltranslation.exception.WalletLockTimeoutException;
import com.example.mltranslation.facade.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

/**
 * 例外 → HTTP 回應
 *
 * - 業務錯誤（BusinessRuleException）：4xx，訊息原樣回傳
 * - 暫時性錯誤（鎖等待逾時、翻譯失敗、佇列無法發布）：503，可重試
 * - 其他：500，不回傳內部訊息
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(UserNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleUserNotFound(
            UserNotFoundException ex, HttpServletRequest request) {
        log.warn("UserNotFoundException: {}", ex.getMessage());
        return build(HttpStatus.NOT_FOUND, "User Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(UserAlreadyExistsException.class)
    public ResponseEntity<ErrorResponse> handleUserAlreadyExists(
            UserAlreadyExistsException ex, HttpServletRequest request) {
        log.warn("UserAlreadyExistsException: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "User Already Exists", ex.getMessage(), request);
    }

    @ExceptionHandler(ExternalIdConflictException.class)
    public ResponseEntity<ErrorResponse> handleExternalIdConflict(
            ExternalIdConflictException ex, HttpServletRequest request) {
        log.warn("ExternalIdConflictException: {}", ex.getMessage());
        return build(HttpStatus.CONFLICT, "Duplicate Request", ex.getMessage(), request);
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientFunds(
            InsufficientFundsException ex, HttpServletRequest request) {
        log.warn("InsufficientFundsException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Insufficient Funds", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidCredentials(
            InvalidCredentialsException ex, HttpServletRequest request) {
        log.warn("InvalidCredentialsException: {}", ex.getMessage());
        return build(HttpStatus.UNAUTHORIZED, "Unauthorized", ex.getMessage(), request);
    }

    @ExceptionHandler(BusinessRuleException.class)
    public ResponseEntity<ErrorResponse> handleBusinessRule(
            BusinessRuleException ex, HttpServletRequest request) {
        log.warn("{}: {}", ex.getClass().getSimpleName(), ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), request);
    }

    @ExceptionHandler(WalletLockTimeoutException.class)
    public ResponseEntity<ErrorResponse> handleWalletLockTimeout(
            WalletLockTimeoutException ex, HttpServletRequest request) {
        log.error("WalletLockTimeoutException: {}", ex.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Wallet Busy", "Wallet is busy, please retry", request);
    }

    @ExceptionHandler(TranslationFailedException.class)
    public ResponseEntity<ErrorResponse> handleTranslationFailed(
            TranslationFailedException ex, HttpServletRequest request) {
        log.error("TranslationFailedException: {}", ex.getMessage(), ex);
        String message = ex.isTimedOut() ? "Translation timed out, please retry" : "Translation failed, please retry";
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Translation Unavailable", message, request);
    }

    @ExceptionHandler(TaskPublishException.class)
    public ResponseEntity<ErrorResponse> handleTaskPublish(
            TaskPublishException ex, HttpServletRequest request) {
        log.error("TaskPublishException: {}", ex.getMessage(), ex);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "Queue Unavailable", "Task could not be queued, please retry", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        log.error("IllegalArgumentException: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        log.error("MethodArgumentNotValidException: validation failed for @RequestBody");

        String message = ex.getBindingResult().getAllErrors().stream()
                .map(error -> {
                    if (error instanceof FieldError fieldError) {
                        return fieldError.getField() + ": " + error.getDefaultMessage();
                    } else {
                        return error.getDefaultMessage();  // Object-level validation
                    }
                })
                .collect(Collectors.joining("; "));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", message, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        log.error("ConstraintViolationException: validation failed for @PathVariable or @RequestParam");

        String message = ex.getConstraintViolations().stream()
                .map(violation -> {
                    String propertyPath = violation.getPropertyPath().toString();
                    String paramName = propertyPath.substring(propertyPath.lastIndexOf('.') + 1);
                    return paramName + ": " + violation.getMessage();
                })
                .collect(Collectors.joining("; "));

        return build(HttpStatus.BAD_REQUEST, "Validation Failed", message, request);
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex, HttpServletRequest request) {
        log.error("Malformed request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed Request", "Request could not be read", request);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(
            NoResourceFoundException ex, HttpServletRequest request) {
        return build(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        return build(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        log.error("Unexpected exception: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected error occurred", request);
    }

    private static ResponseEntity<ErrorResponse> build(
            HttpStatus status, String error, String message, HttpServletRequest request) {
        ErrorResponse body = ErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .timestamp(LocalDateTime.now())
                .path(request.getRequestURI())
                .build();

        return ResponseEntity.status(status).body(body);
    }
}
