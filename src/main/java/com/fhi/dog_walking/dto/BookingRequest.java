package com.fhi.dog_walking.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Booking as sent by a client on creation. {@code cancelled} cannot be sent: a new booking
 * is never cancelled.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookingRequest {

    /**
     * Hex id of the owner.
     */
    @NotNull
    private String owner;

    /**
     * RFC3339 date-time, e.g. "2025-04-28T12:00:00Z".
     */
    @NotNull
    private String startTime;

    @NotNull
    @Min(0)
    @Max(255)
    private Integer durationMinutes;
}
