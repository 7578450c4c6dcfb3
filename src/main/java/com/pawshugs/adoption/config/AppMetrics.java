package com.pawshugs.adoption.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Application metrics for the adoption service.
 *
 * View at: http://localhost:8000/actuator/metrics
 *
 * Key metrics:
 * - pets.search.count          → Catalog searches executed
 * - pets.search.time           → MongoDB catalog query time
 * - adoption.requests.accepted → Requests persisted
 * - adoption.requests.rejected → Requests refused (tag: reason)
 * - pets.seeded                → Fixture pets inserted by /seed
 */
@Component
@Getter
public class AppMetrics {

    private final MeterRegistry registry;

    private final Timer petSearchTimer;

    private final Counter petSearchCounter;
    private final Counter adoptionAcceptedCounter;
    private final Counter seededPetsCounter;

    public AppMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.petSearchTimer = Timer.builder("pets.search.time")
                .description("MongoDB pet catalog query time")
                .tag("database", "mongodb")
                .register(registry);

        this.petSearchCounter = Counter.builder("pets.search.count")
                .description("Pet catalog searches executed")
                .register(registry);

        this.adoptionAcceptedCounter = Counter.builder("adoption.requests.accepted")
                .description("Adoption requests persisted")
                .register(registry);

        this.seededPetsCounter = Counter.builder("pets.seeded")
                .description("Fixture pets inserted by the seed routine")
                .register(registry);
    }

    public void recordPetSearch(long millis) {
        petSearchCounter.increment();
        petSearchTimer.record(millis, TimeUnit.MILLISECONDS);
    }

    public void incrementAdoptionAccepted() {
        adoptionAcceptedCounter.increment();
    }

    /**
     * Rejections are tagged by reason (invalid_id, pet_not_found, store_unavailable).
     */
    public void incrementAdoptionRejected(String reason) {
        Counter.builder("adoption.requests.rejected")
                .description("Adoption requests refused")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementSeededPets(int count) {
        seededPetsCounter.increment(count);
    }
}
