package com.fhi.dog_walking.repo;

import java.util.List;

import org.bson.BsonValue;
import org.bson.Document;
import org.bson.types.ObjectId;
import org.springframework.core.convert.ConversionException;
import org.springframework.dao.DataAccessException;
import org.springframework.data.mapping.model.MappingInstantiationException;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import com.fhi.dog_walking.convert.ObjectIds;
import com.fhi.dog_walking.convert.UpdateFieldSet;
import com.fhi.dog_walking.model.Identifiable;
import com.fhi.dog_walking.service.exception.AppException;
import com.mongodb.MongoException;
import com.mongodb.client.result.DeleteResult;
import com.mongodb.client.result.InsertOneResult;
import com.mongodb.client.result.UpdateResult;

import lombok.extern.slf4j.Slf4j;

/**
 * Create / read / update / delete of one resource against its MongoDB collection.
 *
 * <p>Every failure leaves this class as an {@link AppException}: store errors become
 * DATABASE_ERROR, malformed ids INVALID_ID (checked before any store access), missing
 * documents NOT_FOUND. Nothing is retried.
 *
 * <p>Instances are stateless: the {@link MongoOperations} handle is shared and thread-safe.
 *
 * @param <E> the stored entity
 */
@Slf4j
public abstract class MongoGateway<E extends Identifiable> 
{
    private static final String ID = "_id";

    private final MongoOperations mongo;
    private final Class<E>        entityClass;
    private final String          resourceName;


    protected MongoGateway(MongoOperations mongo, Class<E> entityClass, String resourceName) 
    {   this.mongo        = mongo;
        this.entityClass  = entityClass;
        this.resourceName = resourceName;
    }


    /**
     * Inserts {@code entity}, whose id is already assigned.
     *
     * <p>The insert goes through the collection directly so that the driver's acknowledgement
     * can be checked: a write that is not acknowledged, or that does not report an ObjectId
     * back, is a failure.
     *
     * @return {@code entity}, unchanged
     */
    public E create(E entity) 
    {
        try 
        {   Document document = new Document();
            mongo.getConverter().write(entity, document);

            InsertOneResult result = mongo.getCollection(mongo.getCollectionName(entityClass))
                                          .insertOne(document);

            BsonValue insertedId = result.wasAcknowledged() ? result.getInsertedId() : null;
            if (insertedId == null || !insertedId.isObjectId()) 
            {   throw AppException.databaseError(String.format("Failed to Create new %s: %s", resourceName, insertedId), null);
            }

            log.debug("{} created: {}", resourceName, insertedId.asObjectId().getValue().toHexString());
            return entity;
        } 
        catch (MongoException | DataAccessException e) 
        {   throw AppException.databaseError(String.format("Failed to Create new %s: %s", resourceName, e.getMessage()), e);
        }
    }


    /**
     * A stored document that cannot be mapped back to {@code E} fails the whole read.
     *
     * @return every stored document, in no particular order
     */
    public List<E> readAll() 
    {
        try 
        {   return mongo.findAll(entityClass);
        } 
        catch (MongoException | DataAccessException | ConversionException | MappingInstantiationException e) 
        {   throw AppException.databaseError(String.format("Error reading %s entries from DB: %s", resourceName, e.getMessage()), e);
        }
    }


    /**
     * @throws AppException INVALID_ID, NOT_FOUND or DATABASE_ERROR
     */
    public E readOne(String id) 
    {
        ObjectId objectId = ObjectIds.decode(id);

        E entity;
        try 
        {   entity = mongo.findById(objectId, entityClass);
        } 
        catch (MongoException | DataAccessException | ConversionException | MappingInstantiationException e) 
        {   throw AppException.databaseError(String.format("Failed to Read %s: %s", resourceName, e.getMessage()), e);
        }

        if (entity == null) 
        {   throw AppException.notFound(id);
        }
        return entity;
    }


    /**
     * @throws AppException INVALID_ID or DATABASE_ERROR
     */
    public String update(String id, UpdateFieldSet fields) 
    {   return update(ObjectIds.decode(id), fields);
    }

    /**
     * Applies {@code fields} as a partial {@code $set}.
     *
     * <p>No existence check: an update matching no document is reported as a success.
     *
     * @return the hex id of the updated document
     */
    public String update(ObjectId id, UpdateFieldSet fields) 
    {
        try 
        {   UpdateResult result = mongo.updateFirst(byId(id), fields.toUpdate(), entityClass);
            log.debug("{} update of {} on {}: matched {}", 
                      resourceName, fields, id, result.wasAcknowledged() ? result.getMatchedCount() : "unacknowledged");
        } 
        catch (MongoException | DataAccessException e) 
        {   throw AppException.databaseError(String.format("Failed to Update %s: %s", resourceName, e.getMessage()), e);
        }
        return ObjectIds.encode(id);
    }


    /**
     * @return the hex id of the deleted document
     * @throws AppException INVALID_ID, NOT_FOUND (nothing deleted), INTERNAL_ERROR or DATABASE_ERROR
     */
    public String delete(String id) 
    {
        ObjectId objectId = ObjectIds.decode(id);

        DeleteResult result;
        try 
        {   result = mongo.remove(byId(objectId), entityClass);
        } 
        catch (MongoException | DataAccessException e) 
        {   throw AppException.databaseError(String.format("Failed to Delete %s: %s", resourceName, e.getMessage()), e);
        }

        if (!result.wasAcknowledged()) 
        {   throw AppException.databaseError(String.format("Failed to Delete %s: write not acknowledged", resourceName), null);
        }

        long deletedCount = result.getDeletedCount();
        if (deletedCount >= 1) 
        {   return ObjectIds.encode(objectId);
        }
        if (deletedCount == 0) 
        {   throw AppException.notFound(id);
        }
        throw AppException.internalError(String.format("Negative deleted count %d for %s %s", deletedCount, resourceName, id));
    }


    /**
     * @return whether a document with this id is stored
     */
    public boolean exists(ObjectId id) 
    {
        try 
        {   return mongo.exists(byId(id), entityClass);
        } 
        catch (MongoException | DataAccessException e) 
        {   throw AppException.databaseError(String.format("Failed to Read %s: %s", resourceName, e.getMessage()), e);
        }
    }


    public String getResourceName() 
    {   return resourceName;
    }


    private static Query byId(ObjectId id) 
    {   return Query.query(Criteria.where(ID).is(id));
    }
}
