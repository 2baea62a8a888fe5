package com.fhi.dog_walking.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of a Dog. There is no way to clear {@code age} or {@code breed} once set.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DogUpdateRequest {

    private String owner;

    @Size(min = 1)
    private String name;

    @Min(0)
    @Max(255)
    private Integer age;

    private String breed;
}
