package com.fhi.dog_walking.convert;

import org.bson.types.ObjectId;

import com.fhi.dog_walking.service.exception.AppException;

/**
 * Converts between {@link ObjectId} and the 24 character lowercase hex string clients see.
 *
 * <p>Every id coming from a client, in a path or embedded in a payload, goes through
 * {@link #decode(String)} or {@link #decodeReference(String, String)}.
 */
public final class ObjectIds 
{
   private ObjectIds() 
   {}

   public static String encode(ObjectId id) 
   {  return id.toHexString();
   }

   /**
    * @throws AppException INVALID_ID if {@code hex} is null or not a well-formed id
    */
   public static ObjectId decode(String hex) 
   {  if (hex == null || !ObjectId.isValid(hex)) 
      {  throw AppException.invalidId(hex);
      }
      return new ObjectId(hex);
   }

   /**
    * Decodes the id of a referenced document (e.g. the owner of a Dog).
    *
    * @param field name of the payload field holding the reference
    * @throws AppException DATABASE_ERROR carrying the field and raw value if not a well-formed id
    */
   public static ObjectId decodeReference(String field, String hex) 
   {  if (hex == null || !ObjectId.isValid(hex)) 
      {  throw AppException.invalidReference(field, hex);
      }
      return new ObjectId(hex);
   }
}
