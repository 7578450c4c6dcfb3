package com.pawshugs.adoption.config;

/**
 * Environment-derived MongoDB settings (DATABASE_URL / DATABASE_NAME).
 * Only presence matters outside of Spring's own Mongo auto-configuration.
 */
public record StoreSettings(
    String url,
    String databaseName
) {
    public boolean isUrlSet() {
        return url != null && !url.isBlank();
    }

    public boolean isDatabaseNameSet() {
        return databaseName != null && !databaseName.isBlank();
    }

    public boolean isConfigured() {
        return isUrlSet() && isDatabaseNameSet();
    }
}
