package io.github.drompincen.todolist.gateway.controller;

import io.github.drompincen.todolist.protocol.api.CreateTodoRequest;
import io.github.drompincen.todolist.protocol.api.DataResponse;
import io.github.drompincen.todolist.protocol.api.TodoDto;
import io.github.drompincen.todolist.runtime.todo.TodoService;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/todo")
public class TodoController {

    private static final List<String> ALLOWED_METHODS = List.of("GET", "POST", "DELETE");

    private final TodoService todoService;

    public TodoController(TodoService todoService) {
        this.todoService = todoService;
    }

    @GetMapping
    public ResponseEntity<DataResponse<List<TodoDto>>> list() {
        return ResponseEntity.ok(DataResponse.of(todoService.list()));
    }

    @PostMapping
    public ResponseEntity<DataResponse<TodoDto>> create(@RequestBody(required = false) CreateTodoRequest req) {
        return ResponseEntity.ok(DataResponse.of(todoService.create(req)));
    }

    @DeleteMapping
    public ResponseEntity<Void> deleteAll() {
        todoService.deleteAll();
        return ResponseEntity.noContent().build();
    }

    /** HEAD and OPTIONS would otherwise be answered implicitly by Spring MVC. */
    @RequestMapping(method = {RequestMethod.HEAD, RequestMethod.OPTIONS})
    public ResponseEntity<Void> notAllowed(HttpMethod method) throws HttpRequestMethodNotSupportedException {
        throw new HttpRequestMethodNotSupportedException(method.name(), ALLOWED_METHODS);
    }
}
