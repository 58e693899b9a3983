package io.github.drompincen.todolist.runtime.todo;

/**
 * Base of every failure raised while serving a todo operation. The kind is what the
 * HTTP boundary keys its response mapping on.
 */
public abstract class TodoException extends RuntimeException {

    private final TodoErrorKind kind;

    protected TodoException(TodoErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected TodoException(TodoErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public TodoErrorKind getKind() { return kind; }
}
