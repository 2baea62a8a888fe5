package com.fhi.dog_walking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SitterResponse {

    @JsonProperty("_id")
    private String id;
    private String firstname;
    private String lastname;
    private String gender;
    private String email;
    private String phone;
    private String address;
}
