package com.pawshugs.adoption.service;

import com.pawshugs.adoption.config.AppMetrics;
import com.pawshugs.adoption.model.PetDocument;
import com.pawshugs.adoption.model.PetSearch;
import com.pawshugs.adoption.model.PetView;
import com.pawshugs.adoption.repository.DocumentStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Pet catalog: turns search criteria into a MongoDB query over the pet collection.
 *
 * Query shape:
 * - is_adopted = false, always
 * - species / size, exact match when given
 * - q, case-insensitive literal substring on name OR description OR location
 *
 * All present filters are ANDed. Result order is whatever MongoDB returns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PetCatalogService {

    private final DocumentStore store;
    private final AppMetrics metrics;

    public List<PetView> listPets(PetSearch search) {
        MongoOperations mongo = store.require();
        Query query = buildQuery(search);
        log.debug("Pet catalog query: {}", query.getQueryObject());

        long startTime = System.currentTimeMillis();
        List<PetDocument> documents = mongo.find(query, PetDocument.class);
        long duration = System.currentTimeMillis() - startTime;
        metrics.recordPetSearch(duration);

        log.debug("Found {} adoptable pets in {}ms", documents.size(), duration);
        return documents.stream()
                .map(PetView::from)
                .collect(Collectors.toList());
    }

    static Query buildQuery(PetSearch search) {
        Query query = new Query(Criteria.where(PetDocument.IS_ADOPTED).is(false));

        if (search.hasSpecies()) {
            query.addCriteria(Criteria.where(PetDocument.SPECIES).is(search.species()));
        }
        if (search.hasSize()) {
            query.addCriteria(Criteria.where(PetDocument.SIZE).is(search.size()));
        }
        if (search.hasQuery()) {
            // Free text is matched literally, never as a client-supplied regex
            Pattern contains = Pattern.compile(Pattern.quote(search.query()), Pattern.CASE_INSENSITIVE);
            query.addCriteria(new Criteria().orOperator(
                    Criteria.where(PetDocument.NAME).regex(contains),
                    Criteria.where(PetDocument.DESCRIPTION).regex(contains),
                    Criteria.where(PetDocument.LOCATION).regex(contains)));
        }
        return query;
    }
}
