package com.fhi.dog_walking.service;

import org.bson.types.ObjectId;
import org.springframework.stereotype.Service;

import com.fhi.dog_walking.convert.BookingConverter;
import com.fhi.dog_walking.convert.UpdateFieldSet;
import com.fhi.dog_walking.dto.BookingRequest;
import com.fhi.dog_walking.dto.BookingResponse;
import com.fhi.dog_walking.dto.BookingUpdateRequest;
import com.fhi.dog_walking.model.Booking;
import com.fhi.dog_walking.repo.BookingGateway;

@Service
public class BookingService extends ResourceService<BookingRequest, BookingUpdateRequest, Booking, BookingResponse>
{
    private final OwnerReferences ownerReferences;

    public BookingService(BookingConverter converter, BookingGateway gateway, OwnerReferences ownerReferences) 
    {   super(converter, gateway);
        this.ownerReferences = ownerReferences;
    }

    @Override
    protected void beforeCreate(Booking booking) 
    {   ownerReferences.verify(Booking.OWNER, booking.getOwner());
    }

    @Override
    protected void beforeUpdate(UpdateFieldSet fields) 
    {   fields.get(Booking.OWNER, ObjectId.class)
              .ifPresent(owner -> ownerReferences.verify(Booking.OWNER, owner));
    }
}
