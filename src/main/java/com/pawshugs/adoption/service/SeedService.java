package com.pawshugs.adoption.service;

import com.pawshugs.adoption.config.AppMetrics;
import com.pawshugs.adoption.model.PetDocument;
import com.pawshugs.adoption.model.PetFixture;
import com.pawshugs.adoption.model.SeedResult;
import com.pawshugs.adoption.repository.DocumentStore;
import com.pawshugs.adoption.repository.SeedFixtureLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Populates an empty pet collection with the starter fixture.
 *
 * Count-then-insert is not atomic: two concurrent calls against an empty
 * collection can both insert the fixture. Seeding is a one-off bootstrap
 * step, so duplicates are accepted rather than guarded by a unique index.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SeedService {

    private final DocumentStore store;
    private final SeedFixtureLoader fixtureLoader;
    private final AppMetrics metrics;

    public SeedResult seedIfEmpty() {
        MongoOperations mongo = store.require();

        long existing = mongo.count(new Query(), PetDocument.class);
        if (existing > 0) {
            log.info("Pet collection already holds {} pets, skipping seed", existing);
            return new SeedResult(true, existing);
        }

        List<PetFixture> fixtures = fixtureLoader.load();
        Instant now = Instant.now();
        for (PetFixture fixture : fixtures) {
            mongo.insert(fixture.toDocument(now));
        }

        metrics.incrementSeededPets(fixtures.size());
        log.info("Seeded {} starter pets", fixtures.size());
        return new SeedResult(false, fixtures.size());
    }
}
