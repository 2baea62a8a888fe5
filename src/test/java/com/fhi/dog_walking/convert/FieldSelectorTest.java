package com.fhi.dog_walking.convert;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;

import org.bson.Document;
import org.bson.types.ObjectId;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fhi.dog_walking.model.Booking;
import com.fhi.dog_walking.service.exception.AppException;
import com.fhi.dog_walking.service.exception.AppException.Kind;

class FieldSelectorTest 
{
    @DisplayName("Only supplied fields are selected, decoded and parsed")
    @Test
    void selectsSuppliedFields() 
    {
        // GIVEN:
        String owner = new ObjectId().toHexString();

        // WHEN:
        UpdateFieldSet fields = FieldSelector.create()
                                             .reference(Booking.OWNER, owner)
                                             .startTime(Booking.START_TIME, "2025-04-28T12:00:00Z")
                                             .value(Booking.DURATION_MINUTES, null)
                                             .value(Booking.CANCELLED, true)
                                             .select();

        // THEN:
        assertEquals(3, fields.size());
        assertFalse(fields.contains(Booking.DURATION_MINUTES));
        assertEquals(new ObjectId(owner), fields.get(Booking.OWNER, ObjectId.class).orElseThrow());
        assertEquals(Instant.parse("2025-04-28T12:00:00Z"), fields.get(Booking.START_TIME, Instant.class).orElseThrow());
        assertEquals(Boolean.TRUE, fields.get(Booking.CANCELLED, Boolean.class).orElseThrow());
    }


    @DisplayName("The selected fields become a $set, never a full replace")
    @Test
    void toUpdateIsASet() 
    {
        UpdateFieldSet fields = FieldSelector.create()
                                             .value(Booking.CANCELLED, true)
                                             .select();

        Document updateObject = fields.toUpdate().getUpdateObject();

        assertEquals(1, updateObject.size());
        Document set = (Document) updateObject.get("$set");
        assertEquals(new Document(Booking.CANCELLED, true), set);
    }


    @DisplayName("Nothing supplied fails with PARSE_ERROR 'No fields provided to update'")
    @Test
    void noFields() 
    {
        FieldSelector selector = FieldSelector.create()
                                              .value("name", null)
                                              .reference("owner", null)
                                              .startTime("start_time", null);

        AppException ex = assertThrows(AppException.class, selector::select);

        assertEquals(Kind.PARSE_ERROR, ex.getKind());
        assertEquals("Parse error: No fields provided to update", ex.getMessage());
    }


    @DisplayName("A malformed supplied reference fails with DATABASE_ERROR")
    @Test
    void malformedReference() 
    {
        AppException ex = assertThrows(AppException.class, 
                                       () -> FieldSelector.create().reference(Booking.OWNER, "1234"));

        assertEquals(Kind.DATABASE_ERROR, ex.getKind());
        assertEquals(Booking.OWNER, ex.getField());
    }


    @DisplayName("A malformed supplied start time fails with PARSE_ERROR")
    @Test
    void malformedStartTime() 
    {
        AppException ex = assertThrows(AppException.class, 
                                       () -> FieldSelector.create().startTime(Booking.START_TIME, "12:00"));

        assertEquals(Kind.PARSE_ERROR, ex.getKind());
        assertEquals("Parse error: Start time must include a date", ex.getMessage());
    }
}
