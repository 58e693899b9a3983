package io.github.drompincen.todolist.persistence.document;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TodoDocumentTest {

    @Test
    void newTodoIsNotCompleted() {
        TodoDocument doc = new TodoDocument();
        doc.setText("Todo Text 1");

        assertThat(doc.getId()).isNull();
        assertThat(doc.getText()).isEqualTo("Todo Text 1");
        assertThat(doc.isCompleted()).isFalse();
    }

    @Test
    void todoFieldsPreserved() {
        TodoDocument doc = new TodoDocument();
        doc.setId(7L);
        doc.setText("Edit Text");
        doc.setCompleted(true);

        assertThat(doc.getId()).isEqualTo(7L);
        assertThat(doc.getText()).isEqualTo("Edit Text");
        assertThat(doc.isCompleted()).isTrue();
    }
}
