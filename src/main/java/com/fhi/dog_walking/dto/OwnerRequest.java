package com.fhi.dog_walking.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Owner as sent by a client on creation. The id is never sent: it is generated.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OwnerRequest {

    @NotNull
    @Size(min = 1)
    private String name;

    @NotBlank
    @Email
    private String email;

    @NotNull
    @Size(min = 7, message = "Phone number too short")
    private String phone;

    @NotNull
    @Size(min = 5)
    private String address;
}
