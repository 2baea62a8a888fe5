package com.fhi.dog_walking.service;

import java.util.List;

import org.bson.types.ObjectId;

import com.fhi.dog_walking.convert.ObjectIds;
import com.fhi.dog_walking.convert.ResourceConverter;
import com.fhi.dog_walking.convert.UpdateFieldSet;
import com.fhi.dog_walking.model.Identifiable;
import com.fhi.dog_walking.repo.MongoGateway;

import lombok.extern.slf4j.Slf4j;

/**
 * The request to response pipeline shared by all resources:
 * payload, conversion (validation), gateway, conversion (projection).
 *
 * <p>Subclasses hook extra checks before writes through {@link #beforeCreate} and
 * {@link #beforeUpdate}.
 *
 * @param <Q> creation request
 * @param <U> update request
 * @param <E> stored entity
 * @param <R> response
 */
@Slf4j
public abstract class ResourceService<Q, U, E extends Identifiable, R> 
{
   protected final ResourceConverter<Q, U, E, R> converter;
   protected final MongoGateway<E>               gateway;


   protected ResourceService(ResourceConverter<Q, U, E, R> converter, MongoGateway<E> gateway) 
   {  this.converter = converter;
      this.gateway   = gateway;
   }


   public R create(Q request) 
   {  log.debug("Creating {}", converter.resourceName());
      E entity = converter.toEntity(request);
      beforeCreate(entity);
      return converter.toResponse(gateway.create(entity));
   }

   public List<R> readAll() 
   {  log.debug("Reading all {}s", converter.resourceName());
      return converter.toResponses(gateway.readAll());
   }

   public R readOne(String id) 
   {  log.debug("Reading {} with id: {}", converter.resourceName(), id);
      return converter.toResponse(gateway.readOne(id));
   }

   /**
    * The id is checked first, then the supplied fields: an update without any field
    * never reaches the store.
    *
    * @return hex id of the updated document
    */
   public String update(String id, U update) 
   {  log.debug("Updating {} with id: {}", converter.resourceName(), id);
      ObjectId objectId = ObjectIds.decode(id);
      UpdateFieldSet fields = converter.toUpdate(update);
      beforeUpdate(fields);
      return gateway.update(objectId, fields);
   }

   /**
    * @return hex id of the deleted document
    */
   public String delete(String id) 
   {  log.debug("Deleting {} with id: {}", converter.resourceName(), id);
      return gateway.delete(id);
   }

   public String resourceName() 
   {  return converter.resourceName();
   }


   /**
    * Called with the converted entity, before it is inserted. Does nothing by default.
    */
   protected void beforeCreate(E entity) 
   {}

   /**
    * Called with the validated fields, before they are applied. Does nothing by default.
    */
   protected void beforeUpdate(UpdateFieldSet fields) 
   {}
}
