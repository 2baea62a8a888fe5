package com.fhi.dog_walking.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Envelope of every successful response:
 * <pre>
 *   { "success": true, "data": {...} }
 *   { "success": true, "message": "Booking Deleted: 6630f1..." }
 * </pre>
 * Absent {@code data} or {@code message} are left out of the JSON.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> 
{
   private final boolean success;
   private final T       data;
   private final String  message;

   public static <T> ApiResponse<T> success(T data) 
   {  return new ApiResponse<>(true, data, null);
   }

   public static ApiResponse<Void> withMessage(String message) 
   {  return new ApiResponse<>(true, null, message);
   }
}
