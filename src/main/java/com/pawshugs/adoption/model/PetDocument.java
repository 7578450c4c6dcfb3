package com.pawshugs.adoption.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.time.Instant;

/**
 * MongoDB document representing one adoptable animal.
 * Field names are the snake_case keys stored in the {@code pet} collection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "pet")
public class PetDocument {

    public static final String NAME = "name";
    public static final String SPECIES = "species";
    public static final String SIZE = "size";
    public static final String DESCRIPTION = "description";
    public static final String LOCATION = "location";
    public static final String IS_ADOPTED = "is_adopted";

    @Id
    private String id;

    private String name;

    private String species;

    @Field("age_years")
    private Double ageYears;

    private String gender;

    private String size;

    private String description;

    @Field("photo_url")
    private String photoUrl;

    private String location;

    @Field(IS_ADOPTED)
    private Boolean adopted;

    @Field("created_at")
    private Instant createdAt;

    @Field("updated_at")
    private Instant updatedAt;
}
