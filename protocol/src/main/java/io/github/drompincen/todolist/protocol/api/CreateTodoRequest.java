package io.github.drompincen.todolist.protocol.api;

/**
 * Body of a create call. Only {@code text} is accepted; completion state always starts as false.
 */
public record CreateTodoRequest(String text) {}
