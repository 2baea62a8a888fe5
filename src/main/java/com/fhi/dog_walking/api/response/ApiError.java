package com.fhi.dog_walking.api.response;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Body of every error response: {@code { "error": "Invalid ID format" }}.
 * Only ever holds the human-readable message, never a stack trace or driver error.
 */
@Getter
@AllArgsConstructor
public class ApiError 
{
   private final String error;
}
