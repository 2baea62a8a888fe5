package com.fhi.dog_walking.convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.data.mongodb.core.query.Update;

/**
 * The validated fields of a partial update, keyed by their stored field name.
 * Built by {@link FieldSelector}, never empty.
 */
public class UpdateFieldSet 
{
   private final Map<String, Object> fields;

   UpdateFieldSet(Map<String, Object> fields) 
   {  this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
   }

   public Map<String, Object> asMap() 
   {  return fields;
   }

   public boolean contains(String field) 
   {  return fields.containsKey(field);
   }

   public <T> Optional<T> get(String field, Class<T> type) 
   {  return Optional.ofNullable(fields.get(field))
                     .filter(type::isInstance)
                     .map(type::cast);
   }

   public int size() 
   {  return fields.size();
   }

   /**
    * A {@code $set} of every field: fields not in this set are left untouched.
    */
   public Update toUpdate() 
   {  Update update = new Update();
      fields.forEach(update::set);
      return update;
   }

   @Override
   public String toString() 
   {  return "UpdateFieldSet" + fields.keySet();
   }
}
