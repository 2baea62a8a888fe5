package com.fhi.dog_walking.controller;

import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.fhi.dog_walking.dto.OwnerRequest;
import com.fhi.dog_walking.dto.OwnerResponse;
import com.fhi.dog_walking.dto.OwnerUpdateRequest;
import com.fhi.dog_walking.service.OwnerService;

@RestController
@RequestMapping("/owners")
public class OwnerController extends ResourceController<OwnerRequest, OwnerUpdateRequest, OwnerResponse>
{
    public OwnerController(OwnerService ownerService) {
        super(ownerService);
    }
}
