package com.pawshugs.adoption.exception;

/**
 * A stored pet document lacks a required field and cannot be exposed.
 */
public class PetRecordCorruptedException extends RuntimeException {

    private final String petId;
    private final String field;

    public PetRecordCorruptedException(String petId, String field) {
        super("Pet record " + petId + " is missing required field: " + field);
        this.petId = petId;
        this.field = field;
    }

    public String getPetId() { return petId; }

    public String getField() { return field; }
}
