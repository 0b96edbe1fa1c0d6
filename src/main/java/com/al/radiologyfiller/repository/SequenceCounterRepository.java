package com.al.radiologyfiller.repository;

import com.al.radiologyfiller.model.SequenceCounter;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SequenceCounterRepository
        extends MongoRepository<SequenceCounter, String>, SequenceCounterRepositoryCustom {
}
