package com.pawshugs.adoption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * MongoDB document for a prospective adopter's interest in one pet.
 * Written once, never read back by this service.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "adoptionrequest")
public class AdoptionRequestDocument {

    @Id
    private String id;

    @Field("pet_id")
    private String petId;

    @Field("full_name")
    private String fullName;

    private String email;

    private String phone;

    private String message;

    // Client-supplied properties beyond the known requester fields
    private Map<String, Object> details;

    @Field("created_at")
    private Instant createdAt;

    @Field("updated_at")
    private Instant updatedAt;

    public static AdoptionRequestDocument from(AdoptionRequestPayload payload, Instant now) {
        return AdoptionRequestDocument.builder()
                .petId(payload.getPetId())
                .fullName(payload.getFullName())
                .email(payload.getEmail())
                .phone(payload.getPhone())
                .message(payload.getMessage())
                .details(storableDetails(payload.getDetails()))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * MongoDB map keys may not contain '.' or start with '$'; such entries are
     * left out. Returns null when nothing remains so the field is not written.
     */
    static Map<String, Object> storableDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        Map<String, Object> storable = new LinkedHashMap<>();
        details.forEach((key, value) -> {
            if (!key.contains(".") && !key.startsWith("$")) {
                storable.put(key, value);
            }
        });
        return storable.isEmpty() ? null : storable;
    }
}
