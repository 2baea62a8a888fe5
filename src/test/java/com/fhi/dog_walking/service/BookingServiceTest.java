package com.fhi.dog_walking.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;

import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fhi.dog_walking.config.DogWalkingProperties;
import com.fhi.dog_walking.convert.BookingConverter;
import com.fhi.dog_walking.convert.RequestValidator;
import com.fhi.dog_walking.convert.UpdateFieldSet;
import com.fhi.dog_walking.dto.BookingRequest;
import com.fhi.dog_walking.dto.BookingResponse;
import com.fhi.dog_walking.dto.BookingUpdateRequest;
import com.fhi.dog_walking.model.Booking;
import com.fhi.dog_walking.repo.BookingGateway;
import com.fhi.dog_walking.repo.OwnerGateway;
import com.fhi.dog_walking.service.exception.AppException;
import com.fhi.dog_walking.service.exception.AppException.Kind;

import jakarta.validation.Validation;

@ExtendWith(MockitoExtension.class)
class BookingServiceTest 
{
   private static final String BOOKING_ID = "6630f1a2b3c4d5e6f7a8b9c0";
   private static final String OWNER_ID   = "662f00aa11bb22cc33dd44ee";

   @Mock
   private BookingGateway bookingGateway;

   @Mock
   private OwnerGateway ownerGateway;

   private DogWalkingProperties properties;
   private BookingService       bookingService;


   @BeforeEach
   void setup() 
   {  properties = new DogWalkingProperties();
      BookingConverter converter = new BookingConverter(new RequestValidator(Validation.buildDefaultValidatorFactory().getValidator()));
      bookingService = new BookingService(converter, bookingGateway, new OwnerReferences(properties, ownerGateway));
   }


    @DisplayName("A new booking is stored not cancelled, with its start time normalized to UTC")
    @Test
    void create() 
    {
        // GIVEN:
        when(bookingGateway.create(any(Booking.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // WHEN:
        BookingResponse response = bookingService.create(new BookingRequest(OWNER_ID, "2025-04-28T14:00:00+02:00", 30));

        // THEN:
        ArgumentCaptor<Booking> stored = ArgumentCaptor.forClass(Booking.class);
        verify(bookingGateway).create(stored.capture());
        assertEquals(Instant.parse("2025-04-28T12:00:00Z"), stored.getValue().getStartTime());
        assertFalse(stored.getValue().isCancelled());

        assertEquals("2025-04-28T12:00:00Z", response.getStartTime());
        assertEquals(30, response.getDurationMinutes());
        assertFalse(response.isCancelled());
        assertEquals(OWNER_ID, response.getOwner());
    }


    @DisplayName("A start time without a date fails with PARSE_ERROR and nothing is stored")
    @Test
    void createWithoutDate() 
    {
        AppException ex = assertThrows(AppException.class, 
                                       () -> bookingService.create(new BookingRequest(OWNER_ID, "12:00:00Z", 30)));

        assertEquals(Kind.PARSE_ERROR, ex.getKind());
        assertEquals(Booking.START_TIME, ex.getField());
        verifyNoInteractions(bookingGateway);
    }


    @DisplayName("A malformed owner reference is a DATABASE_ERROR carrying the field")
    @Test
    void createWithMalformedOwner() 
    {
        AppException ex = assertThrows(AppException.class, 
                                       () -> bookingService.create(new BookingRequest("not-an-id", "2025-04-28T12:00:00Z", 30)));

        assertEquals(Kind.DATABASE_ERROR, ex.getKind());
        assertEquals(Booking.OWNER, ex.getField());
        verifyNoInteractions(bookingGateway);
    }


    @DisplayName("Cancelling a booking does not look the owner up, even with verification on")
    @Test
    void cancel() 
    {
        properties.setVerifyOwnerReferences(true);
        when(bookingGateway.update(eq(new ObjectId(BOOKING_ID)), any(UpdateFieldSet.class))).thenReturn(BOOKING_ID);

        String updatedId = bookingService.update(BOOKING_ID, new BookingUpdateRequest(null, null, null, true));

        assertEquals(BOOKING_ID, updatedId);
        verifyNoInteractions(ownerGateway);

        ArgumentCaptor<UpdateFieldSet> fields = ArgumentCaptor.forClass(UpdateFieldSet.class);
        verify(bookingGateway).update(eq(new ObjectId(BOOKING_ID)), fields.capture());
        assertEquals(Boolean.TRUE, fields.getValue().get(Booking.CANCELLED, Boolean.class).orElseThrow());
    }


    @Test
    void updateOwnerWithVerification() 
    {
        properties.setVerifyOwnerReferences(true);
        when(ownerGateway.exists(new ObjectId(OWNER_ID))).thenReturn(true);
        when(bookingGateway.update(eq(new ObjectId(BOOKING_ID)), any(UpdateFieldSet.class))).thenReturn(BOOKING_ID);

        assertEquals(BOOKING_ID, bookingService.update(BOOKING_ID, new BookingUpdateRequest(OWNER_ID, null, null, null)));
        verify(ownerGateway).exists(new ObjectId(OWNER_ID));
    }


    @Test
    void readAll() 
    {
        Booking booking = new Booking(new ObjectId(BOOKING_ID), new ObjectId(OWNER_ID), Instant.parse("2025-04-28T12:00:00Z"), 45, true);
        when(bookingGateway.readAll()).thenReturn(List.of(booking));

        List<BookingResponse> responses = bookingService.readAll();

        assertEquals(1, responses.size());
        assertEquals(BOOKING_ID, responses.get(0).getId());
        assertTrue(responses.get(0).isCancelled());
    }
}
