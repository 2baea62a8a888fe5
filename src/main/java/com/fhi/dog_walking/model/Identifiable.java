package com.fhi.dog_walking.model;

import org.bson.types.ObjectId;

/**
 * A document stored in its own collection, identified by a MongoDB {@link ObjectId}.
 */
public interface Identifiable 
{
   ObjectId getId();
}
