package com.fhi.dog_walking.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DogRequest {

    /**
     * Hex id of the owner.
     */
    @NotNull
    private String owner;

    @NotBlank
    private String name;

    @Min(0)
    @Max(255)
    private Integer age;

    private String breed;
}
