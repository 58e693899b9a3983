package io.github.drompincen.todolist.runtime.todo;

import io.github.drompincen.todolist.persistence.document.TodoDocument;
import io.github.drompincen.todolist.persistence.repository.TodoRepository;
import io.github.drompincen.todolist.persistence.sequence.SequenceGenerator;
import io.github.drompincen.todolist.protocol.api.CreateTodoRequest;
import io.github.drompincen.todolist.protocol.api.TodoDto;
import io.github.drompincen.todolist.protocol.api.UpdateTodoRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;

@Service
public class TodoService {

    private static final Logger log = LoggerFactory.getLogger(TodoService.class);

    private final TodoRepository todoRepository;
    private final SequenceGenerator sequenceGenerator;

    public TodoService(TodoRepository todoRepository, SequenceGenerator sequenceGenerator) {
        this.todoRepository = todoRepository;
        this.sequenceGenerator = sequenceGenerator;
    }

    public List<TodoDto> list() {
        return store("list todos", () -> todoRepository.findAllByOrderByIdAsc().stream()
                .map(TodoService::toDto).collect(Collectors.toList()));
    }

    public TodoDto create(CreateTodoRequest req) {
        if (req == null || req.text() == null) {
            throw new ValidationException("text is required");
        }
        TodoDocument saved = store("create todo", () -> {
            TodoDocument doc = new TodoDocument();
            doc.setId(sequenceGenerator.next(TodoDocument.SEQUENCE_NAME));
            doc.setText(req.text());
            doc.setCompleted(false);
            return todoRepository.save(doc);
        });
        log.info("Created todo {}", saved.getId());
        return toDto(saved);
    }

    public void deleteAll() {
        store("delete all todos", () -> {
            todoRepository.deleteAll();
            return null;
        });
        log.info("Deleted all todos");
    }

    public TodoDto update(long id, UpdateTodoRequest req) {
        UpdateTodoRequest changes = req == null ? UpdateTodoRequest.of(null, null) : req;
        if (changes.hasText() && changes.text().isEmpty()) {
            throw new ValidationException("text cannot be null");
        }
        if (changes.hasCompleted() && changes.isCompleted().isEmpty()) {
            throw new ValidationException("isCompleted cannot be null");
        }
        TodoDocument existing = findExisting(id);
        if (changes.hasText()) existing.setText(changes.text().get());
        if (changes.hasCompleted()) existing.setCompleted(changes.isCompleted().get());
        TodoDocument saved = store("update todo " + id, () -> todoRepository.save(existing));
        log.debug("Updated todo {}", id);
        return toDto(saved);
    }

    public void delete(long id) {
        TodoDocument existing = findExisting(id);
        store("delete todo " + id, () -> {
            todoRepository.delete(existing);
            return null;
        });
        log.info("Deleted todo {}", id);
    }

    private TodoDocument findExisting(long id) {
        return store("find todo " + id, () -> todoRepository.findById(id))
                .orElseThrow(() -> NotFoundException.todo(id));
    }

    private static <T> T store(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StoreException("Failed to " + operation, e);
        }
    }

    static TodoDto toDto(TodoDocument doc) {
        return new TodoDto(doc.getId(), doc.getText(), doc.isCompleted());
    }
}
