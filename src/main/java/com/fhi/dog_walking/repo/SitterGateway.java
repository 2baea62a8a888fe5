package com.fhi.dog_walking.repo;

import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.stereotype.Repository;

import com.fhi.dog_walking.model.Sitter;

@Repository
public class SitterGateway extends MongoGateway<Sitter> 
{
    public SitterGateway(MongoOperations mongo) 
    {   super(mongo, Sitter.class, "Sitter");
    }
}
