package com.fhi.dog_walking.controller;

import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.dog_walking.dto.DogRequest;
import com.fhi.dog_walking.dto.DogResponse;
import com.fhi.dog_walking.dto.DogUpdateRequest;
import com.fhi.dog_walking.service.DogService;

@RestController
@RequestMapping("/dogs")
public class DogController extends ResourceController<DogRequest, DogUpdateRequest, DogResponse>
{
    public DogController(DogService dogService) {
        super(dogService);
    }
}
