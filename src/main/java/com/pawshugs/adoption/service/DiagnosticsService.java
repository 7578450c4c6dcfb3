package com.pawshugs.adoption.service;

import com.pawshugs.adoption.config.StoreSettings;
import com.pawshugs.adoption.model.StatusReport;
import com.pawshugs.adoption.repository.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Reports store connectivity and configuration. Never throws: probe failures
 * end up as a short message inside the report.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagnosticsService {

    static final int MAX_COLLECTIONS = 10;
    static final int MAX_ERROR_LENGTH = 50;

    private final DocumentStore store;

    public StatusReport reportStatus() {
        StoreSettings settings = store.settings();
        Optional<MongoOperations> operations = store.operations();

        String database = "Not initialized";
        String connectionStatus = "Not Connected";
        String error = null;
        boolean connected = false;
        List<String> collections = List.of();

        if (operations.isPresent()) {
            try {
                collections = operations.get().getCollectionNames().stream()
                        .sorted()
                        .limit(MAX_COLLECTIONS)
                        .toList();
                connected = true;
                database = "Connected & Working";
                connectionStatus = "Connected";
            } catch (RuntimeException e) {
                error = describe(e);
                database = "Connected but Error";
                connectionStatus = "Error";
                log.warn("MongoDB probe failed: {}", error);
            }
        }

        return new StatusReport(
                "Running",
                database,
                store.isAvailable(),
                connected,
                connectionStatus,
                error,
                settings.isUrlSet(),
                settings.isDatabaseNameSet(),
                collections);
    }

    static String describe(Throwable e) {
        String text = e.getMessage();
        if (text == null || text.isBlank()) {
            text = e.getClass().getSimpleName();
        }
        if (text.length() <= MAX_ERROR_LENGTH) {
            return text;
        }
        int end = MAX_ERROR_LENGTH;
        // Never split a surrogate pair
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }
}
