package com.pawshugs.adoption.controller;

import com.pawshugs.adoption.model.PetSearch;
import com.pawshugs.adoption.model.PetView;
import com.pawshugs.adoption.service.PetCatalogService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Adoptable pet search.
 *
 * Example: GET /api/pets?species=Dog&size=Small&q=calm
 */
@RestController
@RequestMapping("/api/pets")
@RequiredArgsConstructor
public class PetController {

    private final PetCatalogService petCatalogService;

    @GetMapping
    public List<PetView> listPets(
            @RequestParam(required = false) String species,
            @RequestParam(required = false) String size,
            @RequestParam(name = "q", required = false) String query) {
        return petCatalogService.listPets(new PetSearch(species, size, query));
    }
}
