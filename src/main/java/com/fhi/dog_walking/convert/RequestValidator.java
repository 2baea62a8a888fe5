package com.fhi.dog_walking.convert;

import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fhi.dog_walking.service.exception.AppException;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;

/**
 * Runs Bean Validation on incoming payloads and turns violations into a PARSE_ERROR.
 *
 * <p>Field names are reported the way clients send them (snake_case).
 */
@Component
@RequiredArgsConstructor
public class RequestValidator 
{
   private static final PropertyNamingStrategies.SnakeCaseStrategy SNAKE_CASE = new PropertyNamingStrategies.SnakeCaseStrategy();

   private final Validator validator;


   /**
    * @return {@code request}, once validated
    * @throws AppException PARSE_ERROR listing every violation
    */
   public <T> T validate(T request) 
   {
      if (request == null) 
      {  throw AppException.parseError("Invalid input: missing payload");
      }

      Set<ConstraintViolation<T>> violations = validator.validate(request);
      if (violations.isEmpty()) 
      {  return request;
      }

      // Sorted, so the message does not depend on the validator's iteration order
      ConstraintViolation<T> first = violations.stream()
                                               .min(Comparator.comparing(v -> v.getPropertyPath().toString()))
                                               .orElseThrow();
      String detail = violations.stream()
                                .map(v -> fieldName(v) + ": " + v.getMessage())
                                .sorted()
                                .collect(Collectors.joining(", "));

      throw AppException.parseError(fieldName(first),
                                    first.getInvalidValue() == null ? null : String.valueOf(first.getInvalidValue()),
                                    detail,
                                    null);
   }


   private static String fieldName(ConstraintViolation<?> violation) 
   {  return SNAKE_CASE.translate(violation.getPropertyPath().toString());
   }
}
