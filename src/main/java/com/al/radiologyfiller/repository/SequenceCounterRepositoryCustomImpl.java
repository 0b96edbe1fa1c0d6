package com.al.radiologyfiller.repository;

import com.al.radiologyfiller.model.SequenceCounter;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.LocalDateTime;

public class SequenceCounterRepositoryCustomImpl implements SequenceCounterRepositoryCustom {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public SequenceCounterRepositoryCustomImpl(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public long incrementAndGet(String counterKey, String dateKey) {
        Query query = Query.query(Criteria.where("_id").is(counterKey));
        Update update = new Update()
                .inc("value", 1L)
                .setOnInsert("dateKey", dateKey)
                .set("updatedAt", LocalDateTime.now(clock));
        SequenceCounter counter = mongoTemplate.findAndModify(query, update,
                FindAndModifyOptions.options().returnNew(true).upsert(true), SequenceCounter.class);
        if (counter == null) {
            throw new IllegalStateException("Sequence counter upsert returned nothing for " + counterKey);
        }
        return counter.getValue();
    }
}
