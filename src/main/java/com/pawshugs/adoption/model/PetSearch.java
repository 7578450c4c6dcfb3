package com.pawshugs.adoption.model;

/**
 * Loosely specified catalog criteria; blank values mean "no filter".
 */
public record PetSearch(
    String species,
    String size,
    String query
) {
    public static PetSearch any() {
        return new PetSearch(null, null, null);
    }

    public boolean hasSpecies() {
        return hasValue(species);
    }

    public boolean hasSize() {
        return hasValue(size);
    }

    public boolean hasQuery() {
        return hasValue(query);
    }

    private static boolean hasValue(String value) {
        return value != null && !value.isBlank();
    }
}
