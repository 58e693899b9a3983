package io.github.drompincen.todolist.runtime.todo;

public class StoreException extends TodoException {

    public StoreException(String message, Throwable cause) {
        super(TodoErrorKind.STORE, message, cause);
    }
}
