package com.fhi.dog_walking.api.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.fhi.dog_walking.api.response.ApiError;
import com.fhi.dog_walking.service.exception.AppException;
import com.fhi.dog_walking.service.exception.AppException.Kind;

import lombok.extern.slf4j.Slf4j;


/**
 * Translates exceptions raised below the controllers into HTTP responses with an
 * {@link ApiError} body.
 * 
 * <p>This class lives in the api.exception package (rather than next to AppException
 * in the service.exception package) because choosing a status code is an API concern:
 * the service layer only decides which {@link Kind} of failure happened.
 *
 * <p>Client errors are logged at warn level, server errors at error level with their cause.
 * The cause itself never reaches the client.
 */
@Slf4j
@RestControllerAdvice
public class AppExceptionHandler 
{
    static final String INVALID_PAYLOAD = "Invalid input: could not parse JSON payload.";


   /**
    * Handles any {@link AppException}. The body holds the exception's message, the status
    * is derived from its kind, see {@link #mapKindToStatus(AppException)}.
    */
    @ExceptionHandler(AppException.class)
    public ResponseEntity<ApiError> handleAppException(AppException ex) 
    {
        HttpStatus status = mapKindToStatus(ex);

        if (status.is5xxServerError()) 
        {   log.error("Request failed: {}", ex, ex.getCause());
        }
        else 
        {   log.warn("Request rejected: {} (field: {}, value: {})", ex, ex.getField(), ex.getRawValue());
        }

        return ResponseEntity.status(status).body(new ApiError(ex.getMessage()));
    }


    /**
     * Body missing, not JSON, or with a value of the wrong type.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadablePayload(HttpMessageNotReadableException ex) 
    {
        log.warn("Unreadable payload: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ApiError(INVALID_PAYLOAD));
    }


    /**
     * Anything else. Spring's own web exceptions (unknown route, wrong method...) keep
     * their status; everything else is a 500 whose details stay in the logs.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) 
    {
        if (ex instanceof ErrorResponse errorResponse) 
        {   HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("Request rejected with {}: {}", status, ex.getMessage());
            return ResponseEntity.status(status).body(new ApiError(ex.getMessage()));
        }

        log.error("Unexpected error", ex);
        return ResponseEntity.internalServerError().body(new ApiError(Kind.INTERNAL_ERROR.format()));
    }


    /**
     * Rationale behind mapping:
     *   - 400 (Bad Request): the client sent a malformed id, date, field, or a malformed reference
     *   - 404 (Not Found): no document for the id (or for a verified owner reference)
     *   - 500 (Internal Server Error): the store failed, or an unexpected state was reached
     */
    HttpStatus mapKindToStatus(AppException ex) 
    {
        return switch (ex.getKind()) 
        {
            case INVALID_ID,
                 PARSE_ERROR     -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND       -> HttpStatus.NOT_FOUND;
            case DATABASE_ERROR  -> ex.hasField() ? HttpStatus.BAD_REQUEST 
                                                  : HttpStatus.INTERNAL_SERVER_ERROR;
            case INTERNAL_ERROR  -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
