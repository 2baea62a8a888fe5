package com.fhi.dog_walking.service;

import org.bson.types.ObjectId;
import org.springframework.stereotype.Service;

import com.fhi.dog_walking.convert.DogConverter;
import com.fhi.dog_walking.convert.UpdateFieldSet;
import com.fhi.dog_walking.dto.DogRequest;
import com.fhi.dog_walking.dto.DogResponse;
import com.fhi.dog_walking.dto.DogUpdateRequest;
import com.fhi.dog_walking.model.Dog;
import com.fhi.dog_walking.repo.DogGateway;

@Service
public class DogService extends ResourceService<DogRequest, DogUpdateRequest, Dog, DogResponse>
{
    private final OwnerReferences ownerReferences;

    public DogService(DogConverter converter, DogGateway gateway, OwnerReferences ownerReferences) 
    {   super(converter, gateway);
        this.ownerReferences = ownerReferences;
    }

    @Override
    protected void beforeCreate(Dog dog) 
    {   ownerReferences.verify(Dog.OWNER, dog.getOwner());
    }

    @Override
    protected void beforeUpdate(UpdateFieldSet fields) 
    {   fields.get(Dog.OWNER, ObjectId.class)
              .ifPresent(owner -> ownerReferences.verify(Dog.OWNER, owner));
    }
}
