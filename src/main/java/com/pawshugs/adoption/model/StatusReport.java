package com.pawshugs.adoption.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Connectivity and configuration snapshot served by /test.
 *
 * @param database          human readable store status, including any truncated probe error
 * @param initialized       whether a store handle exists
 * @param connected         whether the collection listing probe succeeded
 * @param error             probe failure description, at most 50 characters, null when healthy
 * @param databaseUrlSet    presence of DATABASE_URL, never its value
 * @param databaseNameSet   presence of DATABASE_NAME, never its value
 */
public record StatusReport(
    String backend,
    String database,
    boolean initialized,
    boolean connected,
    @JsonProperty("connection_status") String connectionStatus,
    String error,
    @JsonProperty("database_url") boolean databaseUrlSet,
    @JsonProperty("database_name") boolean databaseNameSet,
    List<String> collections
) {}
