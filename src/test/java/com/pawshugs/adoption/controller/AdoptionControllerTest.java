package com.pawshugs.adoption.controller;

import com.pawshugs.adoption.exception.InvalidPetIdException;
import com.pawshugs.adoption.exception.PetNotFoundException;
import com.pawshugs.adoption.exception.StoreNotConfiguredException;
import com.pawshugs.adoption.model.AdoptionRequestPayload;
import com.pawshugs.adoption.service.AdoptionService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdoptionController.class)
class AdoptionControllerTest {

    private static final String PET_ID = "65f0c0ffee0000000000abcd";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AdoptionService adoptionService;

    @Test
    void submit_validRequest_returnsReceipt() throws Exception {
        when(adoptionService.submitRequest(any())).thenReturn("65f0c0ffee0000000000ffff");

        mockMvc.perform(post("/api/adopt").contentType(MediaType.APPLICATION_JSON).content(body(PET_ID)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Request received"))
                .andExpect(jsonPath("$.request_id").value("65f0c0ffee0000000000ffff"));

        AdoptionRequestPayload expected = new AdoptionRequestPayload(PET_ID);
        expected.setFullName("Ada Lovelace");
        expected.setEmail("ada@example.com");
        expected.setMessage("Big yard");
        verify(adoptionService).submitRequest(expected);
    }

    @Test
    void submit_onlyPetId_isAccepted() throws Exception {
        when(adoptionService.submitRequest(any())).thenReturn("65f0c0ffee0000000000ffff");

        mockMvc.perform(post("/api/adopt").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pet_id\":\"" + PET_ID + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.request_id").value("65f0c0ffee0000000000ffff"));

        verify(adoptionService).submitRequest(new AdoptionRequestPayload(PET_ID));
    }

    @Test
    void submit_unknownProperties_arePassedOnAsDetails() throws Exception {
        when(adoptionService.submitRequest(any())).thenReturn("65f0c0ffee0000000000ffff");

        mockMvc.perform(post("/api/adopt").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pet_id\":\"" + PET_ID + "\",\"household_size\":3,\"preferred_visit\":\"weekend\"}"))
                .andExpect(status().isOk());

        ArgumentCaptor<AdoptionRequestPayload> captor = ArgumentCaptor.forClass(AdoptionRequestPayload.class);
        verify(adoptionService).submitRequest(captor.capture());
        assertThat(captor.getValue().getDetails())
                .containsEntry("household_size", 3)
                .containsEntry("preferred_visit", "weekend");
    }

    @Test
    void submit_invalidPetId_returns400() throws Exception {
        when(adoptionService.submitRequest(any())).thenThrow(new InvalidPetIdException("not-an-id"));

        mockMvc.perform(post("/api/adopt").contentType(MediaType.APPLICATION_JSON).content(body("not-an-id")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Invalid pet ID"));
    }

    @Test
    void submit_unknownPet_returns404() throws Exception {
        when(adoptionService.submitRequest(any())).thenThrow(new PetNotFoundException(PET_ID));

        mockMvc.perform(post("/api/adopt").contentType(MediaType.APPLICATION_JSON).content(body(PET_ID)))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Pet not found"));
    }

    @Test
    void submit_storeNotConfigured_returns500() throws Exception {
        when(adoptionService.submitRequest(any())).thenThrow(new StoreNotConfiguredException());

        mockMvc.perform(post("/api/adopt").contentType(MediaType.APPLICATION_JSON).content(body(PET_ID)))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Database not configured"));
    }

    @Test
    void submit_missingPetId_returns400WithoutCallingService() throws Exception {
        mockMvc.perform(post("/api/adopt").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"full_name\":\"Ada Lovelace\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Error"));

        verifyNoInteractions(adoptionService);
    }

    @Test
    void submit_malformedEmail_returns400WithoutCallingService() throws Exception {
        mockMvc.perform(post("/api/adopt").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"pet_id\":\"" + PET_ID + "\",\"email\":\"not-an-email\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation Error"));

        verifyNoInteractions(adoptionService);
    }

    @Test
    void submit_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/api/adopt").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Malformed request body"));

        verifyNoInteractions(adoptionService);
    }

    private static String body(String petId) {
        return """
                {"pet_id": "%s", "full_name": "Ada Lovelace", "email": "ada@example.com", "message": "Big yard"}
                """.formatted(petId);
    }
}
