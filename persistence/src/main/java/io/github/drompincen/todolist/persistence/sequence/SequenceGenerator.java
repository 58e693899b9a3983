package io.github.drompincen.todolist.persistence.sequence;

import io.github.drompincen.todolist.persistence.document.SequenceDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Service;

/**
 * Hands out monotonically increasing ids per sequence name. The increment is a single
 * atomic findAndModify, so concurrent callers never observe the same value.
 * Values are never handed out twice, even after the records using them are deleted.
 */
@Service
public class SequenceGenerator {

    private static final Logger log = LoggerFactory.getLogger(SequenceGenerator.class);

    private final MongoTemplate mongoTemplate;

    public SequenceGenerator(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public long next(String sequenceName) {
        Query query = new Query(Criteria.where("_id").is(sequenceName));
        Update update = new Update().inc("value", 1L);
        SequenceDocument seq = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                SequenceDocument.class);
        if (seq == null) {
            throw new IllegalStateException("Sequence " + sequenceName + " was not returned after upsert");
        }
        log.debug("Sequence {} advanced to {}", sequenceName, seq.getValue());
        return seq.getValue();
    }
}
