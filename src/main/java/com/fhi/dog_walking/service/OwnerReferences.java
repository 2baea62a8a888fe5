package com.fhi.dog_walking.service;

import org.bson.types.ObjectId;
import org.springframework.stereotype.Component;

import com.fhi.dog_walking.config.DogWalkingProperties;
import com.fhi.dog_walking.convert.ObjectIds;
import com.fhi.dog_walking.repo.OwnerGateway;
import com.fhi.dog_walking.service.exception.AppException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks that an owner referenced by a Dog or a Booking exists, when
 * {@code dog-walking.verify-owner-references} is on. Costs one extra read per write.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OwnerReferences 
{
   private final DogWalkingProperties properties;
   private final OwnerGateway         ownerGateway;

   /**
    * @param field name of the referencing field, reported on failure
    * @throws AppException NOT_FOUND if verification is on and the owner does not exist
    */
   public void verify(String field, ObjectId ownerId) 
   {  if (!properties.isVerifyOwnerReferences()) 
      {  return;
      }
      if (!ownerGateway.exists(ownerId)) 
      {  log.debug("Referenced owner {} does not exist", ownerId);
         throw AppException.notFound(field, ObjectIds.encode(ownerId));
      }
   }
}
