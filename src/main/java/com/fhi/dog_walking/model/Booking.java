package com.fhi.dog_walking.model;

import java.time.Instant;

import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Document(collection = "booking")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Booking implements Identifiable
{
    public static final String OWNER            = "owner";
    public static final String START_TIME       = "start_time";
    public static final String DURATION_MINUTES = "duration_minutes";
    public static final String CANCELLED        = "cancelled";

    @Id
    private ObjectId id;

    /**
     * Id of the owner who made the booking.
     */
    private ObjectId owner;

    /**
     * Stored as a BSON date, millisecond precision.
     */
    @Field(START_TIME)
    private Instant startTime;

    @Field(DURATION_MINUTES)
    private int durationMinutes;

    /**
     * False on creation. Only changed by an explicit update.
     */
    private boolean cancelled;
}
