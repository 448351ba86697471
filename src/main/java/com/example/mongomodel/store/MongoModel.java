package com.example.mongomodel.store;

import com.example.mongomodel.store.exception.ConflictException;
import com.example.mongomodel.store.exception.DecodeException;
import com.example.mongomodel.store.exception.EmptyResultException;
import com.example.mongomodel.store.exception.NotFoundException;
import com.example.mongomodel.store.exception.StoreExecutionException;
import com.example.mongomodel.store.options.AggregateOptions;
import com.example.mongomodel.store.options.FindManyOptions;
import com.example.mongomodel.store.options.FindOneOptions;
import com.example.mongomodel.store.options.OptionsMerger;
import com.example.mongomodel.store.options.UpdateOptions;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import org.bson.BSONException;
import org.bson.Document;
import org.bson.codecs.configuration.CodecConfigurationException;
import org.bson.conversions.Bson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link Model} backed by a single {@link MongoCollection}, resolved once at
 * construction and shared by every call. Instances hold no mutable state and
 * may be used from many threads.
 */
public class MongoModel<T, C> implements Model<T, C> {

    private static final Logger logger = LoggerFactory.getLogger(MongoModel.class);

    private final String name;
    private final MongoCollection<T> collection;
    private final Class<T> documentType;
    private final Class<C> resultType;

    public MongoModel(MongoDatabase database, String name, Class<T> documentType, Class<C> resultType) {
        Objects.requireNonNull(database, "database");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Collection name must not be blank");
        }
        this.name = name;
        this.documentType = Objects.requireNonNull(documentType, "documentType");
        this.resultType = Objects.requireNonNull(resultType, "resultType");
        this.collection = database.getCollection(name, documentType);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public T findOne(Bson filter, FindOneOptions... options) {
        FindOneOptions effective = OptionsMerger.merge(FindOneOptions.empty(), options);
        logger.debug("findOne on {} with filter {}", name, filter);
        T found;
        try {
            found = effective.applyTo(collection.find(orMatchAll(filter))).first();
        } catch (BSONException | CodecConfigurationException e) {
            throw new DecodeException("findOne", name, documentType, e);
        } catch (MongoException e) {
            throw new StoreExecutionException("findOne", name, e);
        }
        if (found == null) {
            throw new NotFoundException("findOne", name);
        }
        return found;
    }

    @Override
    public List<T> findMany(Bson filter, FindManyOptions... options) {
        FindManyOptions effective = OptionsMerger.merge(FindManyOptions.empty(), options);
        logger.debug("findMany on {} with filter {}", name, filter);
        List<T> results = new ArrayList<>();
        try (MongoCursor<T> cursor = effective.applyTo(collection.find(orMatchAll(filter))).iterator()) {
            while (cursor.hasNext()) {
                results.add(cursor.next());
            }
        } catch (BSONException | CodecConfigurationException e) {
            throw new DecodeException("findMany", name, documentType, e);
        } catch (MongoException e) {
            throw new StoreExecutionException("findMany", name, e);
        }
        return results;
    }

    @Override
    public void create(T document) {
        Objects.requireNonNull(document, "document");
        try {
            collection.insertOne(document);
        } catch (MongoWriteException e) {
            throw writeFailure("create", e);
        } catch (MongoException | CodecConfigurationException e) {
            throw new StoreExecutionException("create", name, e);
        }
    }

    @Override
    public void updateOne(Bson filter, Bson update, UpdateOptions... options) {
        Objects.requireNonNull(update, "update");
        UpdateOptions effective = OptionsMerger.merge(UpdateOptions.empty(), options);
        try {
            collection.updateOne(orMatchAll(filter), update, effective.toDriverOptions());
        } catch (MongoWriteException e) {
            throw writeFailure("updateOne", e);
        } catch (MongoException e) {
            throw new StoreExecutionException("updateOne", name, e);
        }
    }

    @Override
    public void updateMany(Bson filter, Bson update, UpdateOptions... options) {
        Objects.requireNonNull(update, "update");
        UpdateOptions effective = OptionsMerger.merge(UpdateOptions.empty(), options);
        try {
            collection.updateMany(orMatchAll(filter), update, effective.toDriverOptions());
        } catch (MongoWriteException e) {
            throw writeFailure("updateMany", e);
        } catch (MongoException e) {
            throw new StoreExecutionException("updateMany", name, e);
        }
    }

    @Override
    public void deleteOne(Bson filter) {
        try {
            collection.deleteOne(orMatchAll(filter));
        } catch (MongoException e) {
            throw new StoreExecutionException("deleteOne", name, e);
        }
    }

    @Override
    public void deleteMany(Bson filter) {
        try {
            collection.deleteMany(orMatchAll(filter));
        } catch (MongoException e) {
            throw new StoreExecutionException("deleteMany", name, e);
        }
    }

    @Override
    public List<C> aggregate(List<? extends Bson> pipeline, AggregateOptions... options) {
        Objects.requireNonNull(pipeline, "pipeline");
        AggregateOptions effective = OptionsMerger.merge(AggregateOptions.empty(), options);
        logger.debug("aggregate on {} with {} stage(s)", name, pipeline.size());
        List<C> results = new ArrayList<>();
        try (MongoCursor<C> cursor = effective.applyTo(collection.aggregate(pipeline, resultType)).iterator()) {
            while (cursor.hasNext()) {
                results.add(cursor.next());
            }
        } catch (BSONException | CodecConfigurationException e) {
            throw new DecodeException("aggregate", name, resultType, e);
        } catch (MongoException e) {
            logger.warn("Aggregation on {} rejected: {}", name, e.getMessage());
            throw new StoreExecutionException("aggregate", name, e);
        }
        if (results.isEmpty()) {
            throw new EmptyResultException(name);
        }
        return results;
    }

    private StoreExecutionException writeFailure(String operation, MongoWriteException e) {
        if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
            return new ConflictException(operation, name, e);
        }
        return new StoreExecutionException(operation, name, e);
    }

    private static Bson orMatchAll(Bson filter) {
        return filter == null ? new Document() : filter;
    }
}
