package com.al.radiologyfiller.repository;

import com.al.radiologyfiller.model.ProcedureRequest;
import com.al.radiologyfiller.model.enums.ProcedureRequestStatus;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class ProcedureRequestRepositoryCustomImplTest {

    @Mock
    private MongoTemplate mongoTemplate;

    @Test
    public void testCompareAndSetStatus() {
        Clock clock = Clock.fixed(Instant.parse("2025-11-10T08:30:00Z"), ZoneOffset.UTC);
        ProcedureRequestRepositoryCustomImpl repository = new ProcedureRequestRepositoryCustomImpl(mongoTemplate, clock);
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(ProcedureRequest.class)))
                .thenReturn(UpdateResult.acknowledged(1L, 1L, null), UpdateResult.acknowledged(0L, 0L, null));

        assertTrue(repository.compareAndSetStatus("req-1", ProcedureRequestStatus.PENDING,
                ProcedureRequestStatus.SCHEDULED));
        assertFalse(repository.compareAndSetStatus("req-1", ProcedureRequestStatus.PENDING,
                ProcedureRequestStatus.SCHEDULED));

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate, times(2)).updateFirst(query.capture(), update.capture(), eq(ProcedureRequest.class));
        assertEquals(new Document("_id", "req-1").append("status", ProcedureRequestStatus.PENDING),
                query.getValue().getQueryObject());
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertEquals(ProcedureRequestStatus.SCHEDULED, set.get("status"));
        assertEquals(LocalDateTime.of(2025, 11, 10, 8, 30), set.get("statusUpdatedAt"));
    }
}
