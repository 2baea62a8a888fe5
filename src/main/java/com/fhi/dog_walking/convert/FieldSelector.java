package com.fhi.dog_walking.convert;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fhi.dog_walking.service.exception.AppException;

/**
 * Selects the fields actually supplied in a partial update request.
 *
 * <p>A null value means the field was not sent and it is skipped. Supplied references
 * and start times are decoded / parsed on the way in.
 *
 * <pre>
 *   UpdateFieldSet fields = FieldSelector.create()
 *                                        .reference(Booking.OWNER, update.getOwner())
 *                                        .startTime(Booking.START_TIME, update.getStartTime())
 *                                        .value(Booking.CANCELLED, update.getCancelled())
 *                                        .select();
 * </pre>
 */
public final class FieldSelector 
{
   static final String NO_FIELDS = "No fields provided to update";

   private final Map<String, Object> fields = new LinkedHashMap<>();

   private FieldSelector() 
   {}

   public static FieldSelector create() 
   {  return new FieldSelector();
   }


   public FieldSelector value(String field, Object value) 
   {  if (value != null) 
      {  fields.put(field, value);
      }
      return this;
   }

   /**
    * @throws AppException DATABASE_ERROR if {@code hex} is supplied but not a well-formed id
    */
   public FieldSelector reference(String field, String hex) 
   {  if (hex != null) 
      {  fields.put(field, ObjectIds.decodeReference(field, hex));
      }
      return this;
   }

   /**
    * @throws AppException PARSE_ERROR if {@code rfc3339} is supplied but malformed
    */
   public FieldSelector startTime(String field, String rfc3339) 
   {  if (rfc3339 != null) 
      {  fields.put(field, StartTimes.parse(rfc3339));
      }
      return this;
   }

   /**
    * @throws AppException PARSE_ERROR "No fields provided to update" if nothing was supplied
    */
   public UpdateFieldSet select() 
   {  if (fields.isEmpty()) 
      {  throw AppException.parseError(NO_FIELDS);
      }
      return new UpdateFieldSet(fields);
   }
}
