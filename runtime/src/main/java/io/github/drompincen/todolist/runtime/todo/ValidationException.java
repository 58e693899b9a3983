package io.github.drompincen.todolist.runtime.todo;

public class ValidationException extends TodoException {

    public ValidationException(String message) {
        super(TodoErrorKind.VALIDATION, message);
    }
}
