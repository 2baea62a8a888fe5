package com.fhi.dog_walking.convert;

import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import com.fhi.dog_walking.dto.DogRequest;
import com.fhi.dog_walking.dto.DogResponse;
import com.fhi.dog_walking.dto.DogUpdateRequest;
import com.fhi.dog_walking.model.Dog;

import lombok.RequiredArgsConstructor;

@Component
@RequiredArgsConstructor
public class DogConverter implements ResourceConverter<DogRequest, DogUpdateRequest, Dog, DogResponse>
{
    private final RequestValidator validator;

    @Override
    public Dog toEntity(DogRequest request) 
    {   validator.validate(request);
        return new Dog(new ObjectId(),
                       ObjectIds.decodeReference(Dog.OWNER, request.getOwner()),
                       request.getName(),
                       request.getAge(),
                       request.getBreed());
    }

    @Override
    public DogResponse toResponse(Dog dog) 
    {   return new DogResponse(ObjectIds.encode(dog.getId()),
                               ObjectIds.encode(dog.getOwner()),
                               dog.getName(),
                               dog.getAge(),
                               dog.getBreed());
    }

    @Override
    public UpdateFieldSet toUpdate(DogUpdateRequest update) 
    {   validator.validate(update);
        return FieldSelector.create()
                            .reference(Dog.OWNER, update.getOwner())
                            .value(Dog.NAME,      update.getName())
                            .value(Dog.AGE,       update.getAge())
                            .value(Dog.BREED,     update.getBreed())
                            .select();
    }

    @Override
    public String resourceName() 
    {   return "Dog";
    }
}
