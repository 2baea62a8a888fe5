package com.fhi.dog_walking.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update of an Owner: null means "leave unchanged".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OwnerUpdateRequest {

    @Size(min = 1)
    private String name;

    @Email
    private String email;

    @Size(min = 7, message = "Phone number too short")
    private String phone;

    @Size(min = 5)
    private String address;
}
