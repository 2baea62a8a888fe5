package com.fhi.dog_walking.convert;

/**
 * Builds a new entity from a creation request: generates its id, validates and parses
 * the received fields. Performs no I/O.
 *
 * @param <Q> the creation request type
 * @param <E> the entity type
 */
@FunctionalInterface
public interface ToEntity<Q, E> 
{
   /**
    * @throws com.fhi.dog_walking.service.exception.AppException if any field is invalid
    */
   E toEntity(Q request);
}
