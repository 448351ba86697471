package com.example.mongomodel.store;

import com.example.mongomodel.store.options.AggregateOptions;
import com.example.mongomodel.store.options.FindManyOptions;
import com.example.mongomodel.store.options.FindOneOptions;
import com.example.mongomodel.store.options.UpdateOptions;
import org.bson.conversions.Bson;

import java.util.List;

/**
 * Typed CRUD and aggregation contract over one collection.
 *
 * <p>Filters, updates and pipelines are store-native expressions forwarded as
 * they are given. The three "nothing matched" outcomes differ on purpose:
 * {@link #findOne} throws, {@link #findMany} returns an empty list and
 * {@link #aggregate} throws {@link com.example.mongomodel.store.exception.EmptyResultException}.
 *
 * @param <T> the stored document type
 * @param <C> the row type produced by aggregations
 */
public interface Model<T, C> {

    /**
     * @return the collection this model is bound to
     */
    String getName();

    /**
     * Returns the first document matching {@code filter}.
     *
     * @throws com.example.mongomodel.store.exception.NotFoundException if nothing matches
     * @throws com.example.mongomodel.store.exception.DecodeException if the document cannot populate {@code T}
     */
    T findOne(Bson filter, FindOneOptions... options);

    /**
     * Returns every matching document in the order the server yields them. An
     * empty list when nothing matches.
     */
    List<T> findMany(Bson filter, FindManyOptions... options);

    /**
     * @throws com.example.mongomodel.store.exception.ConflictException on a unique index violation
     */
    void create(T document);

    /**
     * Applies {@code update} to the first match. Matching nothing is not an error.
     */
    void updateOne(Bson filter, Bson update, UpdateOptions... options);

    void updateMany(Bson filter, Bson update, UpdateOptions... options);

    void deleteOne(Bson filter);

    void deleteMany(Bson filter);

    /**
     * Runs {@code pipeline} in order and decodes every row into {@code C}.
     *
     * @throws com.example.mongomodel.store.exception.EmptyResultException if the pipeline yields no rows
     */
    List<C> aggregate(List<? extends Bson> pipeline, AggregateOptions... options);
}
