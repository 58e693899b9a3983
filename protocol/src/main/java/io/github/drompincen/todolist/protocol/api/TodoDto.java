package io.github.drompincen.todolist.protocol.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TodoDto(
        long id,
        String text,
        @JsonProperty("isCompleted") boolean isCompleted
) {}
