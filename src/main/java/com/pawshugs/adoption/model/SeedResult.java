package com.pawshugs.adoption.model;

/**
 * Outcome of the seed routine: either the existing pet count, or the number inserted.
 */
public record SeedResult(
    boolean alreadySeeded,
    long count
) {
    public String message() {
        return alreadySeeded ? "Already seeded" : "Seeded";
    }
}
