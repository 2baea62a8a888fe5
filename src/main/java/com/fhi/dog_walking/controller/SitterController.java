package com.fhi.dog_walking.controller;

import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.dog_walking.dto.SitterRequest;
import com.fhi.dog_walking.dto.SitterResponse;
import com.fhi.dog_walking.dto.SitterUpdateRequest;
import com.fhi.dog_walking.service.SitterService;

@RestController
@RequestMapping("/sitters")
public class SitterController extends ResourceController<SitterRequest, SitterUpdateRequest, SitterResponse>
{
    public SitterController(SitterService sitterService) {
        super(sitterService);
    }
}
