package com.pawshugs.adoption.exception;

public class InvalidPetIdException extends RuntimeException {

    private final String petId;

    public InvalidPetIdException(String petId) {
        super("Invalid pet ID");
        this.petId = petId;
    }

    public String getPetId() { return petId; }
}
