package com.pawshugs.adoption.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.pawshugs.adoption.exception.PetRecordCorruptedException;

/**
 * Public view of a pet returned by /api/pets.
 */
public record PetView(
    String id,
    String name,
    String species,
    @JsonProperty("age_years") double ageYears,
    String gender,
    String size,
    String description,
    @JsonProperty("photo_url") String photoUrl,
    String location,
    @JsonProperty("is_adopted") boolean adopted
) {

    /**
     * Maps a stored document to its public view.
     * Required fields must be present; a missing is_adopted flag means false.
     *
     * @throws PetRecordCorruptedException if a required field is missing
     */
    public static PetView from(PetDocument doc) {
        String id = required(doc, doc.getId(), "_id");
        return new PetView(
                id,
                required(doc, doc.getName(), PetDocument.NAME),
                required(doc, doc.getSpecies(), PetDocument.SPECIES),
                required(doc, doc.getAgeYears(), "age_years"),
                required(doc, doc.getGender(), "gender"),
                required(doc, doc.getSize(), PetDocument.SIZE),
                doc.getDescription(),
                doc.getPhotoUrl(),
                doc.getLocation(),
                Boolean.TRUE.equals(doc.getAdopted())
        );
    }

    private static <T> T required(PetDocument doc, T value, String field) {
        if (value == null) {
            throw new PetRecordCorruptedException(doc.getId(), field);
        }
        return value;
    }
}
