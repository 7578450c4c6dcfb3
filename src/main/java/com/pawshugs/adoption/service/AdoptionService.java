package com.pawshugs.adoption.service;

import com.pawshugs.adoption.config.AppMetrics;
import com.pawshugs.adoption.exception.InvalidPetIdException;
import com.pawshugs.adoption.exception.PetNotFoundException;
import com.pawshugs.adoption.exception.StoreNotConfiguredException;
import com.pawshugs.adoption.model.AdoptionRequestDocument;
import com.pawshugs.adoption.model.AdoptionRequestPayload;
import com.pawshugs.adoption.model.PetDocument;
import com.pawshugs.adoption.repository.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.types.ObjectId;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Adoption request intake.
 *
 * Flow: validate pet_id format → confirm the pet exists → insert the request.
 * The existence check always precedes the insert; the two steps are not
 * transactional. Adoption status of the pet is deliberately not checked.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdoptionService {

    private final DocumentStore store;
    private final AppMetrics metrics;

    /**
     * @return id of the newly stored adoption request
     * @throws StoreNotConfiguredException if no database is configured
     * @throws InvalidPetIdException if pet_id is not a well-formed ObjectId
     * @throws PetNotFoundException if no pet has that id
     */
    public String submitRequest(AdoptionRequestPayload payload) {
        MongoOperations mongo = store.operations().orElseThrow(() -> {
            metrics.incrementAdoptionRejected("store_unavailable");
            return new StoreNotConfiguredException();
        });

        String petId = payload.getPetId();
        if (petId == null || !ObjectId.isValid(petId)) {
            log.warn("Adoption request rejected, malformed pet id: {}", petId);
            metrics.incrementAdoptionRejected("invalid_id");
            throw new InvalidPetIdException(petId);
        }

        PetDocument pet = mongo.findById(new ObjectId(petId), PetDocument.class);
        if (pet == null) {
            log.warn("Adoption request rejected, no pet with id: {}", petId);
            metrics.incrementAdoptionRejected("pet_not_found");
            throw new PetNotFoundException(petId);
        }

        AdoptionRequestDocument saved = mongo.insert(AdoptionRequestDocument.from(payload, Instant.now()));
        metrics.incrementAdoptionAccepted();
        log.info("Adoption request {} stored for pet {} ({})", saved.getId(), petId, pet.getName());
        return saved.getId();
    }
}
