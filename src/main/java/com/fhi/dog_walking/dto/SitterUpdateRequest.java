package com.fhi.dog_walking.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SitterUpdateRequest {

    @Size(min = 1)
    private String firstname;

    @Size(min = 1)
    private String lastname;

    @Size(min = 1)
    private String gender;

    @Email
    private String email;

    @Size(min = 1)
    private String phone;

    @Size(min = 1)
    private String address;
}
