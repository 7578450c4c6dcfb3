package com.pawshugs.adoption.repository;

import com.pawshugs.adoption.config.StoreSettings;
import com.pawshugs.adoption.exception.StoreNotConfiguredException;
import org.springframework.data.mongodb.core.MongoOperations;

import java.util.Objects;
import java.util.Optional;

/**
 * Handle to the MongoDB document store.
 *
 * Either available (wrapping {@link MongoOperations}) or unavailable when the
 * deployment did not configure a database. Services ask for the operations
 * explicitly instead of reaching for a global client.
 */
public final class DocumentStore {

    public static final String PET_COLLECTION = "pet";
    public static final String ADOPTION_REQUEST_COLLECTION = "adoptionrequest";

    private final Optional<MongoOperations> operations;
    private final StoreSettings settings;

    private DocumentStore(Optional<MongoOperations> operations, StoreSettings settings) {
        this.operations = operations;
        this.settings = settings;
    }

    public static DocumentStore of(MongoOperations operations, StoreSettings settings) {
        return new DocumentStore(Optional.of(Objects.requireNonNull(operations, "operations")), settings);
    }

    public static DocumentStore unavailable(StoreSettings settings) {
        return new DocumentStore(Optional.empty(), settings);
    }

    public Optional<MongoOperations> operations() {
        return operations;
    }

    /**
     * @throws StoreNotConfiguredException if no database is configured
     */
    public MongoOperations require() {
        return operations.orElseThrow(StoreNotConfiguredException::new);
    }

    public boolean isAvailable() {
        return operations.isPresent();
    }

    public StoreSettings settings() {
        return settings;
    }
}
