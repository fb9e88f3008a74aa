package com.aigreentick.services.setupwizard.exception;

import com.aigreentick.services.setupwizard.constants.SetupWizardConstants;
import com.aigreentick.services.setupwizard.dto.response.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.Map;

/**
 * Global exception handler for all controllers
 * Provides consistent error responses across the service
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    // ========================
    // Wizard Exceptions
    // ========================

    @ExceptionHandler(StepNotFoundException.class)
    public ResponseEntity<ApiResponse<Void>> handleStepNotFound(
            StepNotFoundException ex,
            HttpServletRequest request
    ) {
        log.warn("Step not found: {} - Path: {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(StepAccessDeniedException.class)
    public ResponseEntity<ApiResponse<Void>> handleStepAccessDenied(
            StepAccessDeniedException ex,
            HttpServletRequest request
    ) {
        log.warn("Step access denied: {} - Path: {}", ex.getMessage(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.FORBIDDEN)
                .body(ApiResponse.error(ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(StepValidationException.class)
    public ResponseEntity<ApiResponse<Map<String, String>>> handleStepValidation(
            StepValidationException ex,
            HttpServletRequest request
    ) {
        log.warn("Step validation failed: {} - Path: {}", ex.getFieldErrors().keySet(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ex.getFieldErrors(), "Validation failed", ex.getErrorCode()));
    }

    @ExceptionHandler(IncompleteWizardException.class)
    public ResponseEntity<ApiResponse<List<String>>> handleIncompleteWizard(
            IncompleteWizardException ex,
            HttpServletRequest request
    ) {
        log.warn("Wizard incomplete: {} - Path: {}", ex.getIncompleteSteps(), request.getRequestURI());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(ApiResponse.error(ex.getIncompleteSteps(), ex.getMessage(), ex.getErrorCode()));
    }

    @ExceptionHandler(WizardStorageException.class)
    public ResponseEntity<ApiResponse<Void>> handleWizardStorage(
            WizardStorageException ex,
            HttpServletRequest request
    ) {
        log.error("Wizard storage failure: {} - Path: {}", ex.getMessage(), request.getRequestURI(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error(SetupWizardConstants.ERROR_STORAGE_FAILED, ex.getErrorCode()));
    }

    // ========================
    // Request Exceptions
    // ========================

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ApiResponse<Void>> handleConstraintViolation(
            ConstraintViolationException ex
    ) {
        log.warn("Constraint violation: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(ex.getMessage(), "CONSTRAINT_VIOLATION"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(
            MissingServletRequestParameterException ex
    ) {
        String message = "Required parameter '" + ex.getParameterName() + "' is missing";
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(message, "MISSING_PARAMETER"));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex
    ) {
        String message = "Invalid value '" + ex.getValue() + "' for parameter '" + ex.getName() + "'";
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error(message, "INVALID_PARAMETER_TYPE"));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleNotReadable(
            HttpMessageNotReadableException ex
    ) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(ApiResponse.error("Invalid request body format", "INVALID_REQUEST_BODY"));
    }

    // ========================
    // Database Exceptions
    // ========================

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ApiResponse<Void>> handleDataAccess(
            DataAccessException ex,
            HttpServletRequest request
    ) {
        log.error("Database error at path {}", request.getRequestURI(), ex);
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ApiResponse.error("Storage is temporarily unavailable. Please try again later.", "DATABASE_UNAVAILABLE"));
    }

    // ========================
    // Fallback Exception
    // ========================

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        log.error("Unexpected error at path {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("An unexpected error occurred. Please try again later.", "INTERNAL_SERVER_ERROR"));
    }
}
