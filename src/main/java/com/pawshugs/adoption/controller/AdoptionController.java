package com.pawshugs.adoption.controller;

import com.pawshugs.adoption.model.AdoptionReceipt;
import com.pawshugs.adoption.model.AdoptionRequestPayload;
import com.pawshugs.adoption.service.AdoptionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/adopt")
@RequiredArgsConstructor
public class AdoptionController {

    private final AdoptionService adoptionService;

    @PostMapping
    public AdoptionReceipt submit(@Valid @RequestBody AdoptionRequestPayload payload) {
        return AdoptionReceipt.received(adoptionService.submitRequest(payload));
    }
}
