package com.pawshugs.adoption.service;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entity types exposed for schema introspection. Declared here, never discovered.
 */
@Component
public class SchemaRegistry {

    private static final List<String> MODEL_NAMES = List.of("Pet", "AdoptionRequest");

    public List<String> modelNames() {
        return MODEL_NAMES;
    }
}
