package com.fhi.dog_walking.service;

import org.springframework.stereotype.Service;

import com.fhi.dog_walking.convert.SitterConverter;
import com.fhi.dog_walking.dto.SitterRequest;
import com.fhi.dog_walking.dto.SitterResponse;
import com.fhi.dog_walking.dto.SitterUpdateRequest;
import com.fhi.dog_walking.model.Sitter;
import com.fhi.dog_walking.repo.SitterGateway;

@Service
public class SitterService extends ResourceService<SitterRequest, SitterUpdateRequest, Sitter, SitterResponse>
{
    public SitterService(SitterConverter converter, SitterGateway gateway) 
    {   super(converter, gateway);
    }
}
