package com.al.radiologyfiller.repository;

import com.al.radiologyfiller.model.Accession;
import com.al.radiologyfiller.model.AccessionRequestLink;
import com.al.radiologyfiller.model.enums.AccessionStatus;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.LocalDateTime;

public class AccessionRepositoryCustomImpl implements AccessionRepositoryCustom {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public AccessionRepositoryCustomImpl(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.clock = clock;
    }

    @Override
    public boolean appendRequest(String accessionNumber, AccessionRequestLink link) {
        Query query = Query.query(Criteria.where("accessionNumber").is(accessionNumber)
                .and("requests.requestId").ne(link.getRequestId()));
        Update update = new Update().push("requests", link);
        return mongoTemplate.updateFirst(query, update, Accession.class).getModifiedCount() > 0;
    }

    @Override
    public void removeRequest(String accessionNumber, String requestId) {
        Query query = Query.query(Criteria.where("accessionNumber").is(accessionNumber));
        Update update = new Update().pull("requests", new Document("requestId", requestId));
        mongoTemplate.updateFirst(query, update, Accession.class);
    }

    @Override
    public boolean assignStudyInstanceUid(String accessionNumber, String studyInstanceUid) {
        // null also matches a missing field
        Query query = Query.query(Criteria.where("accessionNumber").is(accessionNumber)
                .and("studyInstanceUid").is(null));
        Update update = new Update().set("studyInstanceUid", studyInstanceUid);
        return mongoTemplate.updateFirst(query, update, Accession.class).getModifiedCount() > 0;
    }

    @Override
    public boolean compareAndSetStatus(String accessionNumber, AccessionStatus expected, AccessionStatus next) {
        Query query = Query.query(Criteria.where("accessionNumber").is(accessionNumber).and("status").is(expected));
        Update update = new Update()
                .set("status", next)
                .set("statusUpdatedAt", LocalDateTime.now(clock));
        return mongoTemplate.updateFirst(query, update, Accession.class).getModifiedCount() > 0;
    }
}
