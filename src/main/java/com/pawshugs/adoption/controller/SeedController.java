package com.pawshugs.adoption.controller;

import com.pawshugs.adoption.model.SeedResult;
import com.pawshugs.adoption.service.SeedService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Development helper: fills an empty pet collection with the starter set.
 *
 * Example: POST /seed
 */
@RestController
@RequiredArgsConstructor
public class SeedController {

    private final SeedService seedService;

    @PostMapping("/seed")
    public Map<String, Object> seed() {
        SeedResult result = seedService.seedIfEmpty();
        return Map.of(
                "message", result.message(),
                "count", result.count()
        );
    }
}
