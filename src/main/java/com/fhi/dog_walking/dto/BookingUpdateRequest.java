package com.fhi.dog_walking.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookingUpdateRequest {

    private String owner;

    // RFC3339
    private String startTime;

    @Min(0)
    @Max(255)
    private Integer durationMinutes;

    private Boolean cancelled;
}
