package com.fhi.dog_walking.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookingResponse {

    @JsonProperty("_id")
    private String id;
    private String owner;

    // RFC3339, always UTC
    private String startTime;
    private int durationMinutes;
    private boolean cancelled;
}
