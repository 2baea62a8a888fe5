package com.fhi.dog_walking.model;

import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A dog walker / pet sitter.
 */
@Document(collection = "sitter")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Sitter implements Identifiable
{
    public static final String FIRSTNAME = "firstname";
    public static final String LASTNAME  = "lastname";
    public static final String GENDER    = "gender";
    public static final String EMAIL     = "email";
    public static final String PHONE     = "phone";
    public static final String ADDRESS   = "address";

    @Id 
    private ObjectId id;

    private String firstname;

    private String lastname;

    private String gender;

    private String email;

    private String phone;

    private String address;
}
