package com.pawshugs.adoption;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Paws &amp; Hugs Pet Adoption API.
 *
 * MongoDB access is wired explicitly through {@link com.pawshugs.adoption.repository.DocumentStore};
 * no Spring Data repositories are scanned.
 */
@SpringBootApplication
public class PetAdoptionApplication {

    public static void main(String[] args) {
        SpringApplication.run(PetAdoptionApplication.class, args);
    }
}
