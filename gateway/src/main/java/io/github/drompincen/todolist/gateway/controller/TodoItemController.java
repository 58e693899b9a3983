package io.github.drompincen.todolist.gateway.controller;

import io.github.drompincen.todolist.protocol.api.DataResponse;
import io.github.drompincen.todolist.protocol.api.TodoDto;
import io.github.drompincen.todolist.protocol.api.UpdateTodoRequest;
import io.github.drompincen.todolist.runtime.todo.TodoService;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/todo/{id}")
public class TodoItemController {

    private static final List<String> ALLOWED_METHODS = List.of("PUT", "DELETE");

    private final TodoService todoService;

    public TodoItemController(TodoService todoService) {
        this.todoService = todoService;
    }

    @PutMapping
    public ResponseEntity<DataResponse<TodoDto>> update(@PathVariable long id,
                                                        @RequestBody(required = false) UpdateTodoRequest updates) {
        return ResponseEntity.ok(DataResponse.of(todoService.update(id, updates)));
    }

    @DeleteMapping
    public ResponseEntity<Void> delete(@PathVariable long id) {
        todoService.delete(id);
        return ResponseEntity.noContent().build();
    }

    /** HEAD and OPTIONS would otherwise be answered implicitly by Spring MVC. */
    @RequestMapping(method = {RequestMethod.HEAD, RequestMethod.OPTIONS})
    public ResponseEntity<Void> notAllowed(HttpMethod method) throws HttpRequestMethodNotSupportedException {
        throw new HttpRequestMethodNotSupportedException(method.name(), ALLOWED_METHODS);
    }
}
