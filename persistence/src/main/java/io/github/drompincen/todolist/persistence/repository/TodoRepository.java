package io.github.drompincen.todolist.persistence.repository;

import io.github.drompincen.todolist.persistence.document.TodoDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface TodoRepository extends MongoRepository<TodoDocument, Long> {
    List<TodoDocument> findAllByOrderByIdAsc();
}
