package com.fhi.dog_walking.service;

import org.springframework.stereotype.Service;

import com.fhi.dog_walking.convert.OwnerConverter;
import com.fhi.dog_walking.dto.OwnerRequest;
import com.fhi.dog_walking.dto.OwnerResponse;
import com.fhi.dog_walking.dto.OwnerUpdateRequest;
import com.fhi.dog_walking.model.Owner;
import com.fhi.dog_walking.repo.OwnerGateway;

@Service
public class OwnerService extends ResourceService<OwnerRequest, OwnerUpdateRequest, Owner, OwnerResponse>
{
    public OwnerService(OwnerConverter converter, OwnerGateway gateway) 
    {   super(converter, gateway);
    }
}
