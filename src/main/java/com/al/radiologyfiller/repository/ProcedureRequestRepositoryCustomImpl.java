package com.al.radiologyfiller.repository;

import com.al.radiologyfiller.model.ProcedureRequest;
import com.al.radiologyfiller.model.enums.ProcedureRequestStatus;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.LocalDateTime;

public class ProcedureRequestRepositoryCustomImpl implements ProcedureRequestRepositoryCustom {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public ProcedureRequestRepositoryCustomImpl(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public boolean compareAndSetStatus(String id, ProcedureRequestStatus expected, ProcedureRequestStatus next) {
        Query query = Query.query(Criteria.where("_id").is(id).and("status").is(expected));
        Update update = new Update()
                .set("status", next)
                .set("statusUpdatedAt", LocalDateTime.now(clock));
        return mongoTemplate.updateFirst(query, update, ProcedureRequest.class).getModifiedCount() > 0;
    }
}
