package com.pawshugs.adoption.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pawshugs.adoption.model.PetFixture;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Loads the starter pet set from a classpath JSON fixture.
 * The file is parsed once and cached; it is the only source of seed data.
 */
@Component
public class SeedFixtureLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final String location;
    private volatile List<PetFixture> cached;

    public SeedFixtureLoader(ResourceLoader resourceLoader,
                             ObjectMapper objectMapper,
                             @Value("${app.seed.fixture:classpath:seed/pets.json}") String location) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
        this.location = location;
    }

    public List<PetFixture> load() {
        List<PetFixture> pets = cached;
        if (pets == null) {
            Resource resource = resourceLoader.getResource(location);
            try (InputStream in = resource.getInputStream()) {
                pets = List.copyOf(objectMapper.readValue(in, new TypeReference<List<PetFixture>>() {}));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load seed fixture: " + location, e);
            }
            if (pets.isEmpty()) {
                throw new IllegalStateException("Seed fixture contains no pets: " + location);
            }
            cached = pets;
        }
        return pets;
    }
}
