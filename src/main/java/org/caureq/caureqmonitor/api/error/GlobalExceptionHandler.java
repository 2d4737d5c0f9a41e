package org.caureq.caureqmonitor.api.error;

import com.fasterxml.jackson.core.exc.StreamReadException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.caureqmonitor.service.NotFoundException;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.*;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;
import java.util.*;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {
    private final FieldPaths fieldPaths;

    private ApiError build(ErrorCode code, String msg, String cid, Map<String,Object> details) {
        return new ApiError(Instant.now(), code, msg, cid, details);
    }

    private String cid(HttpServletRequest req) {
        return req.getHeader("X-Correlation-Id");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex,
                                                     HttpServletRequest req) {
        var target = ex.getBindingResult().getTarget();
        Class<?> root = target != null ? target.getClass() : ex.getParameter().getParameterType();

        Map<String, List<String>> fieldErrors = new TreeMap<>();
        for (var fe : ex.getBindingResult().getFieldErrors()) {
            fieldErrors.computeIfAbsent(fieldPaths.toJson(root, fe.getField()), k -> new ArrayList<>())
                    .add(fe.getDefaultMessage());
        }
        for (var ge : ex.getBindingResult().getGlobalErrors()) {
            fieldErrors.computeIfAbsent(ge.getObjectName(), k -> new ArrayList<>()).add(ge.getDefaultMessage());
        }
        log.debug("rejected {} {}: {}", req.getMethod(), req.getRequestURI(), fieldErrors);
        return ResponseEntity.badRequest().body(
                build(ErrorCode.VALIDATION_FAILED, "Validation error", cid(req),
                        Map.of("field_errors", fieldErrors))
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex,
                                                     HttpServletRequest req) {
        String path = null;
        String reason = "invalid or wrongly typed value";
        if (ex.getCause() instanceof JsonMappingException) {
            var jme = (JsonMappingException) ex.getCause();
            path = fieldPaths.toJson(jme);
            if (jme instanceof InvalidFormatException) {
                reason = "invalid value: " + ((InvalidFormatException) jme).getValue();
            }
        } else if (ex.getCause() instanceof StreamReadException) {
            // out-of-range numbers and syntax errors: no reference chain, only the parser position
            var sre = (StreamReadException) ex.getCause();
            if (sre.getProcessor() != null) {
                path = fieldPaths.toJson(sre.getProcessor().getParsingContext());
            }
            if (sre.getOriginalMessage() != null) reason = sre.getOriginalMessage();
        }
        if (path != null && !path.isEmpty()) {
            return ResponseEntity.badRequest().body(
                    build(ErrorCode.BAD_REQUEST, "Unreadable request body", cid(req),
                            Map.of("field_errors", Map.of(path, List.of(reason))))
            );
        }
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Malformed or missing request body", cid(req), Map.of())
        );
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
                                                       HttpServletRequest req) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Invalid value for parameter '" + ex.getName() + "'", cid(req),
                        Map.of("parameter", ex.getName()))
        );
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ErrorCode.NOT_FOUND, ex.getMessage(), cid(req),
                        Map.of("resource", ex.resource(), "id", String.valueOf(ex.id())))
        );
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ApiError> handleConflict(DataIntegrityViolationException ex,
                                                   HttpServletRequest req) {
        log.warn("constraint violation on {} {}: {}", req.getMethod(), req.getRequestURI(),
                ex.getMostSpecificCause().getMessage());
        Map<String,Object> details = new HashMap<>();
        if (ex.getCause() instanceof ConstraintViolationException) {
            var constraint = ((ConstraintViolationException) ex.getCause()).getConstraintName();
            if (constraint != null) details.put("constraint", constraint);
        }
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.CONFLICT, "Conflicts with existing data, nothing was stored", cid(req), details)
        );
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handleNoRoute(NoResourceFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ErrorCode.NOT_FOUND, "No endpoint " + req.getMethod() + " " + req.getRequestURI(),
                        cid(req), Map.of())
        );
    }

    @ExceptionHandler({HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class,
            HttpMediaTypeNotAcceptableException.class})
    public ResponseEntity<ApiError> handleUnsupported(Exception ex, HttpServletRequest req) {
        var status = ((ErrorResponse) ex).getStatusCode();
        return ResponseEntity.status(status).body(
                build(ErrorCode.UNSUPPORTED, ex.getMessage(), cid(req), Map.of())
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, HttpServletRequest req) {
        log.error("unhandled error on {} {}", req.getMethod(), req.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), cid(req), Map.of())
        );
    }
}
