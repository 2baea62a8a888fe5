package com.fhi.dog_walking.convert;

import java.util.List;

/**
 * Projects a stored entity into the shape sent to clients (hex ids, RFC3339 dates).
 * Never fails.
 *
 * @param <E> the entity type
 * @param <R> the response type
 */
@FunctionalInterface
public interface ToResponse<E, R> 
{
   R toResponse(E entity);

   default List<R> toResponses(List<E> entities) 
   {  return entities.stream().map(this::toResponse).toList();
   }
}
