package com.fhi.dog_walking.convert;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.fhi.dog_walking.dto.OwnerRequest;
import com.fhi.dog_walking.dto.OwnerResponse;
import com.fhi.dog_walking.dto.OwnerUpdateRequest;
import com.fhi.dog_walking.model.Owner;
import com.fhi.dog_walking.service.exception.AppException;
import com.fhi.dog_walking.service.exception.AppException.Kind;

import jakarta.validation.Validation;

class OwnerConverterTest 
{
   private OwnerConverter converter;

   @BeforeEach
   void setup() 
   {  converter = new OwnerConverter(new RequestValidator(Validation.buildDefaultValidatorFactory().getValidator()));
   }


    @DisplayName("Creating Jane Doe gives a fresh 24 hex id and echoes every other field")
    @Test
    void createOwner() 
    {
        // GIVEN:
        OwnerRequest request = new OwnerRequest("Jane Doe", "jane@example.com", "5551234567", "1 Main St");

        // WHEN:
        Owner         owner    = converter.toEntity(request);
        OwnerResponse response = converter.toResponse(owner);

        // THEN:
        assertNotNull(owner.getId());
        assertTrue(response.getId().matches("[0-9a-f]{24}"));
        assertEquals(owner.getId().toHexString(), response.getId());
        assertEquals("Jane Doe",         response.getName());
        assertEquals("jane@example.com", response.getEmail());
        assertEquals("5551234567",       response.getPhone());
        assertEquals("1 Main St",        response.getAddress());
    }


    @DisplayName("Each conversion generates a different id")
    @Test
    void idsAreFresh() 
    {
        OwnerRequest request = new OwnerRequest("Jane Doe", "jane@example.com", "5551234567", "1 Main St");

        assertNotEquals(converter.toEntity(request).getId(), converter.toEntity(request).getId());
    }


    @DisplayName("A malformed email is rejected with PARSE_ERROR on the email field")
    @Test
    void malformedEmail() 
    {
        OwnerRequest request = new OwnerRequest("Jane Doe", "not-an-email", "5551234567", "1 Main St");

        AppException ex = assertThrows(AppException.class, () -> converter.toEntity(request));

        assertEquals(Kind.PARSE_ERROR, ex.getKind());
        assertEquals("email", ex.getField());
        assertEquals("not-an-email", ex.getRawValue());
    }


    @DisplayName("A short phone number is rejected with its own message")
    @Test
    void shortPhone() 
    {
        OwnerRequest request = new OwnerRequest("Jane Doe", "jane@example.com", "555", "1 Main St");

        AppException ex = assertThrows(AppException.class, () -> converter.toEntity(request));

        assertEquals("Parse error: phone: Phone number too short", ex.getMessage());
    }


    @DisplayName("A missing required field is rejected")
    @Test
    void missingField() 
    {
        OwnerRequest request = new OwnerRequest("Jane Doe", "jane@example.com", "5551234567", null);

        AppException ex = assertThrows(AppException.class, () -> converter.toEntity(request));

        assertEquals(Kind.PARSE_ERROR, ex.getKind());
        assertEquals("address", ex.getField());
    }


    @DisplayName("An update only selects the supplied fields")
    @Test
    void partialUpdate() 
    {
        OwnerUpdateRequest update = new OwnerUpdateRequest(null, "jane.doe@example.com", null, null);

        UpdateFieldSet fields = converter.toUpdate(update);

        assertEquals(1, fields.size());
        assertEquals("jane.doe@example.com", fields.get(Owner.EMAIL, String.class).orElseThrow());
    }


    @DisplayName("An update without fields fails with PARSE_ERROR")
    @Test
    void emptyUpdate() 
    {
        AppException ex = assertThrows(AppException.class, () -> converter.toUpdate(new OwnerUpdateRequest()));

        assertEquals(Kind.PARSE_ERROR, ex.getKind());
        assertEquals("Parse error: No fields provided to update", ex.getMessage());
    }


    @DisplayName("A supplied field is validated like on creation")
    @Test
    void updateValidatesSuppliedFields() 
    {
        OwnerUpdateRequest update = new OwnerUpdateRequest(null, "nope", null, null);

        AppException ex = assertThrows(AppException.class, () -> converter.toUpdate(update));

        assertEquals(Kind.PARSE_ERROR, ex.getKind());
        assertEquals("email", ex.getField());
    }
}
