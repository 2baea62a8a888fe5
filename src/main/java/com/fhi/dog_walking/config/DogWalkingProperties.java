package com.fhi.dog_walking.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Application settings bound from the {@code dog-walking.*} keys.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "dog-walking")
public class DogWalkingProperties 
{
   /**
    * When true, the owner referenced by a Dog or a Booking must exist in the owner collection
    * before the Dog or Booking is written. Off by default: owner references are stored as sent.
    */
   private boolean verifyOwnerReferences = false;
}
