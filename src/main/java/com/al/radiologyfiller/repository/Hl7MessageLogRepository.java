package com.al.radiologyfiller.repository;

import com.al.radiologyfiller.model.Hl7MessageLog;
import com.al.radiologyfiller.model.enums.MessageLogStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface Hl7MessageLogRepository extends MongoRepository<Hl7MessageLog, String> {

    List<Hl7MessageLog> findByMessageControlIdOrderByReceivedAtDesc(String messageControlId);

    Page<Hl7MessageLog> findByStatus(MessageLogStatus status, Pageable pageable);
}
