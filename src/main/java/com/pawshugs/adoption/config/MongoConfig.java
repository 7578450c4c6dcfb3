package com.pawshugs.adoption.config;

import com.pawshugs.adoption.repository.DocumentStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoOperations;

/**
 * MongoDB Configuration.
 * The store is only handed to services when both DATABASE_URL and DATABASE_NAME
 * are set; otherwise an unavailable {@link DocumentStore} is published so the
 * application still starts and reports "Database not configured" per request.
 */
@Configuration
@Slf4j
public class MongoConfig {

    @Bean
    public StoreSettings storeSettings(
            @Value("${app.store.url:}") String url,
            @Value("${app.store.database-name:}") String databaseName) {
        return new StoreSettings(url, databaseName);
    }

    @Bean
    public DocumentStore documentStore(StoreSettings settings, ObjectProvider<MongoOperations> mongoOperations) {
        if (!settings.isConfigured()) {
            log.warn("MongoDB not configured (DATABASE_URL set: {}, DATABASE_NAME set: {}), store unavailable",
                    settings.isUrlSet(), settings.isDatabaseNameSet());
            return DocumentStore.unavailable(settings);
        }

        MongoOperations operations = mongoOperations.getIfAvailable();
        if (operations == null) {
            log.warn("MongoDB configured but no MongoOperations bean present, store unavailable");
            return DocumentStore.unavailable(settings);
        }

        log.info("MongoDB store initialized for database: {}", settings.databaseName());
        return DocumentStore.of(operations, settings);
    }
}
