package io.github.drompincen.todolist.gateway.controller;

import io.github.drompincen.todolist.protocol.api.ErrorResponse;
import io.github.drompincen.todolist.runtime.todo.NotFoundException;
import io.github.drompincen.todolist.runtime.todo.StoreException;
import io.github.drompincen.todolist.runtime.todo.TodoErrorKind;
import io.github.drompincen.todolist.runtime.todo.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TodoExceptionHandlerTest {

    private final TodoExceptionHandler handler = new TodoExceptionHandler();

    @Test
    void everyKindMapsToGenericInternalError() {
        for (TodoErrorKind kind : TodoErrorKind.values()) {
            ResponseEntity<ErrorResponse> response = TodoExceptionHandler.toResponse(kind);

            assertThat(response.getStatusCode().value()).as(kind.name()).isEqualTo(500);
            assertThat(response.getBody()).isEqualTo(ErrorResponse.generic());
        }
    }

    @Test
    void validationNotFoundAndStoreFailuresLookIdentical() {
        ResponseEntity<ErrorResponse> validation = handler.handleTodo(new ValidationException("text is required"));
        ResponseEntity<ErrorResponse> notFound = handler.handleTodo(NotFoundException.todo(3L));
        ResponseEntity<ErrorResponse> store = handler.handleTodo(new StoreException("down", new RuntimeException()));

        assertThat(validation).isEqualTo(notFound).isEqualTo(store);
        assertThat(validation.getBody().error()).isEqualTo("An error has occurred. Please try again.");
    }

    @Test
    void unexpectedFailureIsCollapsedToo() {
        ResponseEntity<ErrorResponse> response = handler.handleUnexpected(new IllegalStateException("boom"));

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody()).isEqualTo(ErrorResponse.generic());
    }

    @Test
    void methodMismatchListsAllowedMethods() {
        HttpRequestMethodNotSupportedException e =
                new HttpRequestMethodNotSupportedException("PUT", List.of("GET", "POST", "DELETE"));

        ResponseEntity<Void> response = handler.handleMethodNotAllowed(e);

        assertThat(response.getStatusCode().value()).isEqualTo(405);
        assertThat(response.getHeaders().getAllow())
                .containsExactlyInAnyOrder(HttpMethod.GET, HttpMethod.POST, HttpMethod.DELETE);
    }

    @Test
    void headAndOptionsAreNeverAdvertised() {
        HttpRequestMethodNotSupportedException e = new HttpRequestMethodNotSupportedException(
                "PATCH", List.of("GET", "HEAD", "POST", "DELETE", "OPTIONS"));

        ResponseEntity<Void> response = handler.handleMethodNotAllowed(e);

        assertThat(response.getHeaders().getAllow())
                .containsExactlyInAnyOrder(HttpMethod.GET, HttpMethod.POST, HttpMethod.DELETE);
    }
}
