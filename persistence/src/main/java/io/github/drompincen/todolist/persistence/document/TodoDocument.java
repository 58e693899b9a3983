package io.github.drompincen.todolist.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

@Document(collection = "todos")
public class TodoDocument {

    public static final String SEQUENCE_NAME = "todos";

    @Id
    private Long id;
    private String text;
    @Field("is_completed")
    private boolean completed;

    public TodoDocument() {}

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public boolean isCompleted() { return completed; }
    public void setCompleted(boolean completed) { this.completed = completed; }
}
