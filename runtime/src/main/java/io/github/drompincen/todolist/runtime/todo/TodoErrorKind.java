package io.github.drompincen.todolist.runtime.todo;

public enum TodoErrorKind {
    VALIDATION, NOT_FOUND, STORE
}
