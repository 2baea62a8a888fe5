package com.fhi.dog_walking.convert;

/**
 * All conversions of one resource: creation request to entity, entity to response,
 * and partial update request to the set of fields to change.
 *
 * @param <Q> creation request
 * @param <U> update request
 * @param <E> stored entity
 * @param <R> response
 */
public interface ResourceConverter<Q, U, E, R> extends ToEntity<Q, E>, ToResponse<E, R> 
{
   /**
    * @return the fields supplied in {@code update}, validated
    * @throws com.fhi.dog_walking.service.exception.AppException PARSE_ERROR if no field was supplied
    */
   UpdateFieldSet toUpdate(U update);

   /**
    * Resource name as used in messages, e.g. "Booking".
    */
   String resourceName();
}
