package com.fhi.dog_walking.model;

import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import jakarta.annotation.Nullable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Document(collection = "dog")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Dog implements Identifiable
{
    public static final String OWNER = "owner";
    public static final String NAME  = "name";
    public static final String AGE   = "age";
    public static final String BREED = "breed";

    @Id
    private ObjectId id;

    /**
     * Id of the owner. Not checked against the owner collection unless
     * {@code dog-walking.verify-owner-references} is on.
     */
    private ObjectId owner;

    private String name;

    @Nullable // might not be known
    private Integer age;

    @Nullable // might not be known
    private String breed;
}
