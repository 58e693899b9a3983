package io.github.drompincen.todolist.gateway.controller;

import io.github.drompincen.todolist.protocol.api.ErrorResponse;
import io.github.drompincen.todolist.runtime.todo.TodoErrorKind;
import io.github.drompincen.todolist.runtime.todo.TodoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Turns failures into HTTP responses. Every {@link TodoErrorKind} collapses to the same
 * generic envelope; only a method mismatch gets its own status.
 */
@RestControllerAdvice
public class TodoExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(TodoExceptionHandler.class);

    private static final Map<TodoErrorKind, HttpStatus> STATUS_BY_KIND = new EnumMap<>(TodoErrorKind.class);

    static {
        STATUS_BY_KIND.put(TodoErrorKind.VALIDATION, HttpStatus.INTERNAL_SERVER_ERROR);
        STATUS_BY_KIND.put(TodoErrorKind.NOT_FOUND, HttpStatus.INTERNAL_SERVER_ERROR);
        STATUS_BY_KIND.put(TodoErrorKind.STORE, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(TodoException.class)
    public ResponseEntity<ErrorResponse> handleTodo(TodoException e) {
        if (e.getKind() == TodoErrorKind.STORE) {
            log.warn("[{}] {}", e.getKind(), e.getMessage(), e);
        } else {
            log.warn("[{}] {}", e.getKind(), e.getMessage());
        }
        return toResponse(e.getKind());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("[{}] Unreadable request body: {}", TodoErrorKind.VALIDATION, e.getMessage());
        return toResponse(TodoErrorKind.VALIDATION);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleBadIdentifier(MethodArgumentTypeMismatchException e) {
        log.warn("[{}] Unusable identifier '{}'", TodoErrorKind.NOT_FOUND, e.getValue());
        return toResponse(TodoErrorKind.NOT_FOUND);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<Void> handleMethodNotAllowed(HttpRequestMethodNotSupportedException e) {
        Set<HttpMethod> allowed = new LinkedHashSet<>();
        if (e.getSupportedHttpMethods() != null) {
            allowed.addAll(e.getSupportedHttpMethods());
        }
        // the HEAD/OPTIONS rejection mappings show up as supported methods of the path
        allowed.remove(HttpMethod.HEAD);
        allowed.remove(HttpMethod.OPTIONS);
        log.debug("Method {} not allowed, supported: {}", e.getMethod(), allowed);
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .allow(allowed.toArray(new HttpMethod[0]))
                .build();
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(RuntimeException e) {
        log.error("Unexpected failure while serving todo request", e);
        return toResponse(TodoErrorKind.STORE);
    }

    static ResponseEntity<ErrorResponse> toResponse(TodoErrorKind kind) {
        return ResponseEntity.status(STATUS_BY_KIND.get(kind)).body(ErrorResponse.generic());
    }
}
