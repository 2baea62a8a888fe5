package com.fhi.dog_walking.controller;

import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.dog_walking.dto.BookingRequest;
import com.fhi.dog_walking.dto.BookingResponse;
import com.fhi.dog_walking.dto.BookingUpdateRequest;
import com.fhi.dog_walking.service.BookingService;

@RestController
@RequestMapping("/bookings")
public class BookingController extends ResourceController<BookingRequest, BookingUpdateRequest, BookingResponse>
{
    public BookingController(BookingService bookingService) {
        super(bookingService);
    }
}
