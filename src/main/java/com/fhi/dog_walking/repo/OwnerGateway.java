package com.fhi.dog_walking.repo;

import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.stereotype.Repository;

import com.fhi.dog_walking.model.Owner;

@Repository
public class OwnerGateway extends MongoGateway<Owner> 
{
    public OwnerGateway(MongoOperations mongo) 
    {   super(mongo, Owner.class, "Owner");
    }
}
