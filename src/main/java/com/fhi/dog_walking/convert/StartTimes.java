package com.fhi.dog_walking.convert;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Locale;
import java.util.regex.Pattern;

import com.fhi.dog_walking.model.Booking;
import com.fhi.dog_walking.service.exception.AppException;

/**
 * RFC3339 parsing and rendering of booking start times.
 */
public final class StartTimes 
{
   /**
    * "yyyy-MM-dd" at the start of the value.
    */
   private static final Pattern DATE_PART = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}");

   /**
    * RFC3339 "date-time": seconds required, optional fraction, offset "Z" or "+HH:MM".
    * Stricter than {@link DateTimeFormatter#ISO_OFFSET_DATE_TIME}, which also takes
    * "12:00Z", "+02" and "+02:00:30".
    */
   private static final DateTimeFormatter RFC3339 = new DateTimeFormatterBuilder()
                                                        .append(DateTimeFormatter.ISO_LOCAL_DATE)
                                                        .appendLiteral('T')
                                                        .appendValue(ChronoField.HOUR_OF_DAY, 2)
                                                        .appendLiteral(':')
                                                        .appendValue(ChronoField.MINUTE_OF_HOUR, 2)
                                                        .appendLiteral(':')
                                                        .appendValue(ChronoField.SECOND_OF_MINUTE, 2)
                                                        .optionalStart()
                                                        .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
                                                        .optionalEnd()
                                                        .appendOffset("+HH:MM", "Z")
                                                        .toFormatter(Locale.ROOT)
                                                        .withResolverStyle(ResolverStyle.STRICT);

   private StartTimes() 
   {}


   /**
    * Parses an RFC3339 date-time ("2025-04-28T12:00:00Z", "2025-04-28T14:00:00+02:00").
    * The separator may also be a lowercase 't' or a space, as RFC3339 allows.
    *
    * @throws AppException PARSE_ERROR "Start time must include a date" when the date part is missing,
    *                      PARSE_ERROR "Failed to parse start time: ..." for any other malformed value
    */
   public static Instant parse(String raw) 
   {
      if (raw == null || !DATE_PART.matcher(raw).lookingAt()) 
      {  throw AppException.parseError(Booking.START_TIME, raw, "Start time must include a date", null);
      }

      String normalized = raw.toUpperCase(Locale.ROOT);
      if (normalized.length() > 10 && normalized.charAt(10) == ' ') 
      {  normalized = normalized.substring(0, 10) + 'T' + normalized.substring(11);
      }

      try 
      {  return OffsetDateTime.parse(normalized, RFC3339).toInstant();
      } 
      catch (DateTimeParseException e) 
      {  throw AppException.parseError(Booking.START_TIME, raw, "Failed to parse start time: " + e.getMessage(), e);
      }
   }


   /**
    * Renders an instant as an RFC3339 UTC string, e.g. "2025-04-28T12:00:00Z".
    */
   public static String format(Instant instant) 
   {  return DateTimeFormatter.ISO_INSTANT.format(instant);
   }
}
