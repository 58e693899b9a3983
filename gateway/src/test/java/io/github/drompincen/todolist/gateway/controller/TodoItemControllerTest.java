package io.github.drompincen.todolist.gateway.controller;

import io.github.drompincen.todolist.protocol.api.DataResponse;
import io.github.drompincen.todolist.protocol.api.TodoDto;
import io.github.drompincen.todolist.protocol.api.UpdateTodoRequest;
import io.github.drompincen.todolist.runtime.todo.NotFoundException;
import io.github.drompincen.todolist.runtime.todo.TodoService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TodoItemControllerTest {

    @Mock private TodoService todoService;

    private TodoItemController controller;

    @BeforeEach
    void setUp() {
        controller = new TodoItemController(todoService);
    }

    @Test
    void updateReturnsMergedTodo() {
        UpdateTodoRequest req = UpdateTodoRequest.of("Edit Text", true);
        when(todoService.update(1L, req)).thenReturn(new TodoDto(1L, "Edit Text", true));

        ResponseEntity<DataResponse<TodoDto>> response = controller.update(1L, req);

        assertThat(response.getStatusCode().value()).isEqualTo(200);
        assertThat(response.getBody().data()).isEqualTo(new TodoDto(1L, "Edit Text", true));
    }

    @Test
    void updatePropagatesNotFound() {
        UpdateTodoRequest req = UpdateTodoRequest.of("Edit Text", true);
        when(todoService.update(3L, req)).thenThrow(NotFoundException.todo(3L));

        assertThatThrownBy(() -> controller.update(3L, req)).isInstanceOf(NotFoundException.class);
    }

    @Test
    void deleteReturnsNoContent() {
        ResponseEntity<Void> response = controller.delete(1L);

        assertThat(response.getStatusCode().value()).isEqualTo(204);
        verify(todoService).delete(1L);
    }

    @Test
    void deletePropagatesNotFound() {
        doThrow(NotFoundException.todo(3L)).when(todoService).delete(3L);

        assertThatThrownBy(() -> controller.delete(3L)).isInstanceOf(NotFoundException.class);
    }
}
