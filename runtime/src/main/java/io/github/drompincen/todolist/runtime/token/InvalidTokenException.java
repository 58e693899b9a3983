package io.github.drompincen.todolist.runtime.token;

/** Raised when a token cannot be trusted: bad signature, malformed, or signed with another algorithm. */
public class InvalidTokenException extends RuntimeException {

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
