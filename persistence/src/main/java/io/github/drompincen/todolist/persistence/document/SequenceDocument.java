package io.github.drompincen.todolist.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/** Named counter backing store-assigned integer ids. */
@Document(collection = "sequences")
public class SequenceDocument {

    @Id
    private String name;
    private long value;

    public SequenceDocument() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public long getValue() { return value; }
    public void setValue(long value) { this.value = value; }
}
