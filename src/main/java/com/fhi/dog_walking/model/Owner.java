package com.fhi.dog_walking.model;

import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Document(collection = "owner")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Owner implements Identifiable
{
    public static final String NAME    = "name";
    public static final String EMAIL   = "email";
    public static final String PHONE   = "phone";
    public static final String ADDRESS = "address";

    @Id 
    private ObjectId id;

    private String name;

    private String email;

    private String phone;

    private String address;
}
