package com.fhi.dog_walking.service.exception;

/**
 * Exception raised by the conversion, update and persistence layers for every failure
 * that may reach a client.
 *
 * <p>Use the static factory methods to build an {@code AppException} with the right
 * {@link Kind} and a descriptive message. Besides the message, each instance may carry
 * the name of the offending field and the raw value that was received, so that the
 * HTTP layer can decide on its own how to answer.</p>
 *
 * <p>Store-native exceptions (Spring {@code DataAccessException}, driver
 * {@code MongoException}) are wrapped into a {@link Kind#DATABASE_ERROR} at the gateway
 * and kept as the cause: they are logged, never returned to clients.</p>
 */
public class AppException extends RuntimeException 
{
    /**
     * The closed set of error kinds of the application.
     */
   public enum Kind 
   {
      INVALID_ID     ("Invalid ID format"),
      NOT_FOUND      ("Item not found"),
      PARSE_ERROR    ("Parse error: %s"),
      DATABASE_ERROR ("Database error: %s"),
      INTERNAL_ERROR ("Internal server error");

      private final String messageTemplate;

      Kind(String messageTemplate) 
      {  this.messageTemplate = messageTemplate;
      }

      public String format(Object... args) 
      {  return String.format(messageTemplate, args);
      }

      public String getMessageTemplate() 
      {  return messageTemplate;
      }

      public String getCode() 
      {   return this.name();
      }
   }

   private final Kind kind;

   /**
    * Name of the field the failure relates to, as seen by clients (e.g. "start_time"). May be null.
    */
   private final String field;

   /**
    * The raw value received for {@link #field}. May be null.
    */
   private final String rawValue;


   /**
    * @param kind the kind of failure
    * @param message the human-readable rendering sent to clients
    * @param field offending field, or null
    * @param rawValue offending raw value, or null
    * @param cause the original exception, or null
    */
   public AppException(Kind kind, String message, String field, String rawValue, Throwable cause) 
   {  super(message, cause);
      this.kind     = kind;
      this.field    = field;
      this.rawValue = rawValue;
   }

   public Kind getKind() 
   {   return kind;
   }

   public String getField() 
   {   return field;
   }

   public String getRawValue() 
   {   return rawValue;
   }

   public boolean hasField() 
   {   return field != null;
   }


   /**
    * Returns a string with the message of this exception and, if present, the
    * message of its cause.
    *
    * <pre>
    * AppException[DATABASE_ERROR]: Main error message | Caused by: CauseClass: Cause message
    * </pre>
    */
   @Override
   public String toString() 
   {
      String errMsg = String.format("%s[%s]: %s", this.getClass().getSimpleName(), kind, this.getMessage());
      
      Throwable cause = getCause();
      if (     cause != null && cause.getMessage() != null 
            && !cause.getMessage().isBlank()) 
      {  errMsg += String.format(" | Caused by: %s: %s", cause.getClass().getSimpleName(), cause.getMessage());
      }
      return errMsg;
   }



    // -----------------------------------------
    // Static factory methods 
    // -----------------------------------------

   /**
    * An identifier received from a client is not a well-formed 24 hex character id.
    */
   public static AppException invalidId(String rawValue) 
   {  return new AppException(Kind.INVALID_ID, Kind.INVALID_ID.format(), null, rawValue, null);
   }

   /**
    * No document matches the given identifier.
    */
   public static AppException notFound(String id) 
   {  return new AppException(Kind.NOT_FOUND, Kind.NOT_FOUND.format(), null, id, null);
   }

   /**
    * A document referenced through {@code field} does not exist.
    */
   public static AppException notFound(String field, String id) 
   {  return new AppException(Kind.NOT_FOUND, Kind.NOT_FOUND.format(), field, id, null);
   }

   public static AppException parseError(String detail) 
   {  return new AppException(Kind.PARSE_ERROR, Kind.PARSE_ERROR.format(detail), null, null, null);
   }

   /**
    * @param cause pass null if no Throwable cause.
    */
   public static AppException parseError(String field, String rawValue, String detail, Throwable cause) 
   {  return new AppException(Kind.PARSE_ERROR, Kind.PARSE_ERROR.format(detail), field, rawValue, cause);
   }

   /**
    * @param cause pass null if no Throwable cause.
    */
   public static AppException databaseError(String detail, Throwable cause) 
   {  return new AppException(Kind.DATABASE_ERROR, Kind.DATABASE_ERROR.format(detail), null, null, cause);
   }

   /**
    * A reference to another document (e.g. a Dog's owner) is not a well-formed id.
    * Reported as a database error, carrying the field and the received value.
    */
   public static AppException invalidReference(String field, String rawValue) 
   {  return new AppException(Kind.DATABASE_ERROR,
                              Kind.DATABASE_ERROR.format(String.format("invalid %s ID: %s", field, rawValue)),
                              field, rawValue, null);
   }

   /**
    * Something the code assumes unreachable happened.
    */
   public static AppException internalError(String detail) 
   {  return new AppException(Kind.INTERNAL_ERROR, Kind.INTERNAL_ERROR.format(), null, null,
                              new IllegalStateException(detail));
   }
}
