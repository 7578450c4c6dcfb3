package com.pawshugs.adoption.exception;

public class PetNotFoundException extends RuntimeException {

    private final String petId;

    public PetNotFoundException(String petId) {
        super("Pet not found");
        this.petId = petId;
    }

    public String getPetId() { return petId; }
}
