package com.fhi.dog_walking.repo;

import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.stereotype.Repository;

import com.fhi.dog_walking.model.Dog;

@Repository
public class DogGateway extends MongoGateway<Dog> 
{
    public DogGateway(MongoOperations mongo) 
    {   super(mongo, Dog.class, "Dog");
    }
}
