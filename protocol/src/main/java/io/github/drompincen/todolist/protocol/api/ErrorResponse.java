package io.github.drompincen.todolist.protocol.api;

public record ErrorResponse(String error) {

    public static final String GENERIC_MESSAGE = "An error has occurred. Please try again.";

    public static ErrorResponse generic() {
        return new ErrorResponse(GENERIC_MESSAGE);
    }
}
