package com.fhi.dog_walking.repo;

import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.stereotype.Repository;

import com.fhi.dog_walking.model.Booking;

@Repository
public class BookingGateway extends MongoGateway<Booking> 
{
    public BookingGateway(MongoOperations mongo) 
    {   super(mongo, Booking.class, "Booking");
    }
}
