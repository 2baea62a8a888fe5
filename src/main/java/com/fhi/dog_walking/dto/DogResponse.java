package com.fhi.dog_walking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DogResponse {

    @JsonProperty("_id")
    private String id;
    private String owner;
    private String name;
    private Integer age;
    private String breed;
}
