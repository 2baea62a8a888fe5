package com.fhi.dog_walking.convert;

import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import com.fhi.dog_walking.dto.OwnerRequest;
import com.fhi.dog_walking.dto.OwnerResponse;
import com.fhi.dog_walking.dto.OwnerUpdateRequest;
import com.fhi.dog_walking.model.Owner;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class OwnerConverter implements ResourceConverter<OwnerRequest, OwnerUpdateRequest, Owner, OwnerResponse>
{
    private final RequestValidator validator;

    @Override
    public Owner toEntity(OwnerRequest request) 
    {   validator.validate(request);
        return new Owner(new ObjectId(),
                         request.getName(),
                         request.getEmail(),
                         request.getPhone(),
                         request.getAddress());
    }

    @Override
    public OwnerResponse toResponse(Owner owner) 
    {   return new OwnerResponse(ObjectIds.encode(owner.getId()),
                                 owner.getName(),
                                 owner.getEmail(),
                                 owner.getPhone(),
                                 owner.getAddress());
    }

    @Override
    public UpdateFieldSet toUpdate(OwnerUpdateRequest update) 
    {   validator.validate(update);
        return FieldSelector.create()
                            .value(Owner.NAME,    update.getName())
                            .value(Owner.EMAIL,   update.getEmail())
                            .value(Owner.PHONE,   update.getPhone())
                            .value(Owner.ADDRESS, update.getAddress())
                            .select();
    }

    @Override
    public String resourceName() 
    {   return "Owner";
    }
}
