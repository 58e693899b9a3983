package io.github.drompincen.todolist.protocol.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;

import java.io.IOException;
import java.util.Optional;

/**
 * Partial update of a todo.
 * <p>
 * Each component is tri-state: {@code null} when the field is absent from the body,
 * {@link Optional#empty()} when it is sent as JSON {@code null}, and a present value otherwise.
 * Only absent fields leave the stored value untouched.
 */
@JsonDeserialize(using = UpdateTodoRequest.Deserializer.class)
public record UpdateTodoRequest(
        Optional<String> text,
        Optional<Boolean> isCompleted
) {
    /** Builds a request where a {@code null} argument means the field was not sent. */
    public static UpdateTodoRequest of(String text, Boolean isCompleted) {
        return new UpdateTodoRequest(
                text == null ? null : Optional.of(text),
                isCompleted == null ? null : Optional.of(isCompleted));
    }

    @JsonIgnore
    public boolean hasText() {
        return text != null;
    }

    @JsonIgnore
    public boolean hasCompleted() {
        return isCompleted != null;
    }

    static class Deserializer extends StdDeserializer<UpdateTodoRequest> {

        Deserializer() {
            super(UpdateTodoRequest.class);
        }

        @Override
        public UpdateTodoRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            JsonNode node = p.readValueAsTree();
            if (node == null || !node.isObject()) {
                throw MismatchedInputException.from(p, UpdateTodoRequest.class, "update body must be a JSON object");
            }
            Optional<String> text = null;
            JsonNode textNode = node.get("text");
            if (textNode != null) {
                if (textNode.isNull()) {
                    text = Optional.empty();
                } else if (textNode.isTextual()) {
                    text = Optional.of(textNode.asText());
                } else {
                    throw MismatchedInputException.from(p, UpdateTodoRequest.class, "text must be a string");
                }
            }
            Optional<Boolean> completed = null;
            JsonNode completedNode = node.get("isCompleted");
            if (completedNode != null) {
                if (completedNode.isNull()) {
                    completed = Optional.empty();
                } else if (completedNode.isBoolean()) {
                    completed = Optional.of(completedNode.booleanValue());
                } else {
                    throw MismatchedInputException.from(p, UpdateTodoRequest.class, "isCompleted must be a boolean");
                }
            }
            return new UpdateTodoRequest(text, completed);
        }
    }
}
