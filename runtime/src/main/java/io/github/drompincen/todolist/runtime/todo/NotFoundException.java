package io.github.drompincen.todolist.runtime.todo;

public class NotFoundException extends TodoException {

    public NotFoundException(String message) {
        super(TodoErrorKind.NOT_FOUND, message);
    }

    public static NotFoundException todo(long id) {
        return new NotFoundException("Todo " + id + " does not exist");
    }
}
