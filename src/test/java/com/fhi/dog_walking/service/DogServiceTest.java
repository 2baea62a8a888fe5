package com.fhi.dog_walking.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.bson.types.ObjectId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.fhi.dog_walking.config.DogWalkingProperties;
import com.fhi.dog_walking.convert.DogConverter;
import com.fhi.dog_walking.convert.RequestValidator;
import com.fhi.dog_walking.convert.UpdateFieldSet;
import com.fhi.dog_walking.dto.DogRequest;
import com.fhi.dog_walking.dto.DogResponse;
import com.fhi.dog_walking.dto.DogUpdateRequest;
import com.fhi.dog_walking.model.Dog;
import com.fhi.dog_walking.repo.DogGateway;
import com.fhi.dog_walking.repo.OwnerGateway;
import com.fhi.dog_walking.service.exception.AppException;
import com.fhi.dog_walking.service.exception.AppException.Kind;

import jakarta.validation.Validation;

@ExtendWith(MockitoExtension.class)
class DogServiceTest 
{
   private static final String DOG_ID   = "6630f1a2b3c4d5e6f7a8b9c0";
   private static final String OWNER_ID = "662f00aa11bb22cc33dd44ee";

   @Mock
   private DogGateway dogGateway;

   @Mock
   private OwnerGateway ownerGateway;

   private DogWalkingProperties properties;
   private DogService           dogService;


   @BeforeEach
   void setup() 
   {  properties = new DogWalkingProperties();
      DogConverter converter = new DogConverter(new RequestValidator(Validation.buildDefaultValidatorFactory().getValidator()));
      dogService = new DogService(converter, dogGateway, new OwnerReferences(properties, ownerGateway));
   }


    @DisplayName("An update without any field fails with PARSE_ERROR and never reaches the store")
    @Test
    void emptyUpdate() 
    {
        AppException ex = assertThrows(AppException.class, () -> dogService.update(DOG_ID, new DogUpdateRequest()));

        assertEquals(Kind.PARSE_ERROR, ex.getKind());
        assertEquals("Parse error: No fields provided to update", ex.getMessage());
        verifyNoInteractions(dogGateway);
    }


    @DisplayName("A malformed id is reported before the payload is looked at")
    @Test
    void updateWithInvalidId() 
    {
        AppException ex = assertThrows(AppException.class, () -> dogService.update("xyz", new DogUpdateRequest()));

        assertEquals(Kind.INVALID_ID, ex.getKind());
        verifyNoInteractions(dogGateway);
    }


    @Test
    void updateAppliesOnlySuppliedFields() 
    {
        // GIVEN:
        when(dogGateway.update(eq(new ObjectId(DOG_ID)), any(UpdateFieldSet.class))).thenReturn(DOG_ID);

        // WHEN:
        String updatedId = dogService.update(DOG_ID, new DogUpdateRequest(null, null, 5, null));

        // THEN:
        assertEquals(DOG_ID, updatedId);

        ArgumentCaptor<UpdateFieldSet> fields = ArgumentCaptor.forClass(UpdateFieldSet.class);
        verify(dogGateway).update(eq(new ObjectId(DOG_ID)), fields.capture());
        assertEquals(1, fields.getValue().size());
        assertEquals(Integer.valueOf(5), fields.getValue().get(Dog.AGE, Integer.class).orElseThrow());
    }


    @DisplayName("Owner references are stored as sent when verification is off")
    @Test
    void createWithoutVerification() 
    {
        when(dogGateway.create(any(Dog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        DogResponse response = dogService.create(new DogRequest(OWNER_ID, "Rex", 4, "Beagle"));

        assertEquals(OWNER_ID, response.getOwner());
        assertEquals("Rex", response.getName());
        assertNotNull(response.getId());
        verifyNoInteractions(ownerGateway);
    }


    @DisplayName("With verification on, a Dog referencing an unknown owner is rejected with NOT_FOUND on 'owner'")
    @Test
    void createWithUnknownOwner() 
    {
        properties.setVerifyOwnerReferences(true);
        when(ownerGateway.exists(new ObjectId(OWNER_ID))).thenReturn(false);

        AppException ex = assertThrows(AppException.class, 
                                       () -> dogService.create(new DogRequest(OWNER_ID, "Rex", 4, "Beagle")));

        assertEquals(Kind.NOT_FOUND, ex.getKind());
        assertEquals(Dog.OWNER, ex.getField());
        assertEquals(OWNER_ID, ex.getRawValue());
        verifyNoInteractions(dogGateway);
    }


    @Test
    void createWithKnownOwner() 
    {
        properties.setVerifyOwnerReferences(true);
        when(ownerGateway.exists(new ObjectId(OWNER_ID))).thenReturn(true);
        when(dogGateway.create(any(Dog.class))).thenAnswer(invocation -> invocation.getArgument(0));

        DogResponse response = dogService.create(new DogRequest(OWNER_ID, "Rex", null, null));

        assertEquals(OWNER_ID, response.getOwner());
        assertNull(response.getAge());
    }


    @DisplayName("With verification on, changing the owner to an unknown one is rejected")
    @Test
    void updateWithUnknownOwner() 
    {
        properties.setVerifyOwnerReferences(true);
        when(ownerGateway.exists(new ObjectId(OWNER_ID))).thenReturn(false);

        AppException ex = assertThrows(AppException.class, 
                                       () -> dogService.update(DOG_ID, new DogUpdateRequest(OWNER_ID, null, null, null)));

        assertEquals(Kind.NOT_FOUND, ex.getKind());
        verifyNoInteractions(dogGateway);
    }


    @Test
    void deleteDelegatesToGateway() 
    {
        when(dogGateway.delete(DOG_ID)).thenReturn(DOG_ID);

        assertEquals(DOG_ID, dogService.delete(DOG_ID));
    }


    @Test
    void resourceName() 
    {
        assertEquals("Dog", dogService.resourceName());
    }
}
