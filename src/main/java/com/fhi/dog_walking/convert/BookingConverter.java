package com.fhi.dog_walking.convert;

import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import com.fhi.dog_walking.dto.BookingRequest;
import com.fhi.dog_walking.dto.BookingResponse;
import com.fhi.dog_walking.dto.BookingUpdateRequest;
import com.fhi.dog_walking.model.Booking;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class BookingConverter implements ResourceConverter<BookingRequest, BookingUpdateRequest, Booking, BookingResponse>
{
    private final RequestValidator validator;

    /**
     * A new booking is never cancelled, whatever the payload holds.
     */
    @Override
    public Booking toEntity(BookingRequest request) 
    {   validator.validate(request);
        return new Booking(new ObjectId(),
                           ObjectIds.decodeReference(Booking.OWNER, request.getOwner()),
                           StartTimes.parse(request.getStartTime()),
                           request.getDurationMinutes(),
                           false);
    }

    @Override
    public BookingResponse toResponse(Booking booking) 
    {   return new BookingResponse(ObjectIds.encode(booking.getId()),
                                   ObjectIds.encode(booking.getOwner()),
                                   StartTimes.format(booking.getStartTime()),
                                   booking.getDurationMinutes(),
                                   booking.isCancelled());
    }

    @Override
    public UpdateFieldSet toUpdate(BookingUpdateRequest update) 
    {   validator.validate(update);
        return FieldSelector.create()
                            .reference(Booking.OWNER,           update.getOwner())
                            .startTime(Booking.START_TIME,      update.getStartTime())
                            .value(Booking.DURATION_MINUTES,    update.getDurationMinutes())
                            .value(Booking.CANCELLED,           update.getCancelled())
                            .select();
    }

    @Override
    public String resourceName() 
    {   return "Booking";
    }
}
