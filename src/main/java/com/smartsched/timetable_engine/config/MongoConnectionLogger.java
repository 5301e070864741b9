package com.smartsched.timetable_engine.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.stereotype.Component;

import com.smartsched.timetable_engine.model.LearnedValueTable;
import com.smartsched.timetable_engine.model.TimetableSnapshot;

/**
 * Logs on startup whether the snapshot store is reachable and what it holds. The engine still
 * starts without it; only snapshot intake and value-table transfer depend on it.
 */
@Component
public class MongoConnectionLogger implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(MongoConnectionLogger.class);

    private final MongoTemplate mongoTemplate;

    @Value("${spring.data.mongodb.uri:not-set}")
    private String mongoUri;

    public MongoConnectionLogger(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public void run(String... args) {
        logger.info("=== SNAPSHOT STORE CHECK ===");
        logger.info("MongoDB URI: {}", mongoUri.replaceAll(":[^:@]+@", ":****@") + " (masked)");
        try {
            String dbName = mongoTemplate.getDb().getName();
            long snapshots = mongoTemplate.getCollection(mongoTemplate.getCollectionName(TimetableSnapshot.class))
                    .estimatedDocumentCount();
            long tables = mongoTemplate.getCollection(mongoTemplate.getCollectionName(LearnedValueTable.class))
                    .estimatedDocumentCount();
            logger.info("Connected to database {}: {} snapshots, {} learned value tables", dbName, snapshots, tables);
        } catch (Exception e) {
            logger.error("!!! Snapshot store unreachable; snapshot intake and value transfer will fail or start cold: {}",
                    e.getMessage());
        }
    }
}
