package com.pawshugs.adoption.model;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound adoption request as posted to /api/adopt.
 *
 * Only pet_id is required; it is resolved by the workflow. The requester
 * fields are optional, and any other property the client sends is kept in
 * {@link #getDetails()} and stored with the request.
 */
@Data
@NoArgsConstructor
public class AdoptionRequestPayload {

    @NotBlank
    @JsonProperty("pet_id")
    private String petId;

    @JsonProperty("full_name")
    private String fullName;

    @Email
    private String email;

    private String phone;

    @Size(max = 2000)
    private String message;

    @JsonIgnore
    private Map<String, Object> details = new LinkedHashMap<>();

    public AdoptionRequestPayload(String petId) {
        this.petId = petId;
    }

    @JsonAnySetter
    public void putDetail(String name, Object value) {
        details.put(name, value);
    }
}
