package com.al.radiologyfiller.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.MongoDatabaseFactory;
import org.springframework.data.mongodb.MongoTransactionManager;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Unit-of-work boundary for reconciliation. With {@code radiology.transactions-enabled} each unit runs
 * in a MongoDB multi-document transaction; otherwise the callback runs directly and the service relies
 * on write ordering and compensation, which cannot help when the compensating write fails as well.
 */
@Slf4j
@Configuration
public class TransactionConfig {

    @Bean
    public TransactionOperations reconciliationTransactions(RadiologyProperties properties,
            MongoDatabaseFactory databaseFactory) {
        if (!properties.isTransactionsEnabled()) {
            log.warn("MongoDB transactions are disabled: reconciliation falls back to compensating writes, and a "
                    + "storage failure during compensation can leave a procedure request without its accession. "
                    + "Set radiology.transactions-enabled=true on a replica set for production use.");
            return TransactionOperations.withoutTransaction();
        }
        log.info("MongoDB transactions enabled for reconciliation");
        return new TransactionTemplate(new MongoTransactionManager(databaseFactory));
    }
}
