package com.pawshugs.adoption.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One starter pet as written in the seed fixture file.
 */
public record PetFixture(
    String name,
    String species,
    @JsonProperty("age_years") double ageYears,
    String gender,
    String size,
    String description,
    @JsonProperty("photo_url") String photoUrl,
    String location
) {
    public PetDocument toDocument(Instant now) {
        return PetDocument.builder()
                .name(name)
                .species(species)
                .ageYears(ageYears)
                .gender(gender)
                .size(size)
                .description(description)
                .photoUrl(photoUrl)
                .location(location)
                .adopted(false)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
