package com.fhi.dog_walking.convert;

import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import com.fhi.dog_walking.dto.SitterRequest;
import com.fhi.dog_walking.dto.SitterResponse;
import com.fhi.dog_walking.dto.SitterUpdateRequest;
import com.fhi.dog_walking.model.Sitter;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class SitterConverter implements ResourceConverter<SitterRequest, SitterUpdateRequest, Sitter, SitterResponse>
{
    private final RequestValidator validator;

    @Override
    public Sitter toEntity(SitterRequest request) 
    {   validator.validate(request);
        return new Sitter(new ObjectId(),
                          request.getFirstname(),
                          request.getLastname(),
                          request.getGender(),
                          request.getEmail(),
                          request.getPhone(),
                          request.getAddress());
    }

    @Override
    public SitterResponse toResponse(Sitter sitter) 
    {   return new SitterResponse(ObjectIds.encode(sitter.getId()),
                                  sitter.getFirstname(),
                                  sitter.getLastname(),
                                  sitter.getGender(),
                                  sitter.getEmail(),
                                  sitter.getPhone(),
                                  sitter.getAddress());
    }

    @Override
    public UpdateFieldSet toUpdate(SitterUpdateRequest update) 
    {   validator.validate(update);
        return FieldSelector.create()
                            .value(Sitter.FIRSTNAME, update.getFirstname())
                            .value(Sitter.LASTNAME,  update.getLastname())
                            .value(Sitter.GENDER,    update.getGender())
                            .value(Sitter.EMAIL,     update.getEmail())
                            .value(Sitter.PHONE,     update.getPhone())
                            .value(Sitter.ADDRESS,   update.getAddress())
                            .select();
    }

    @Override
    public String resourceName() 
    {   return "Sitter";
    }
}
