package com.example.mongomodel.store.exception;

/**
 * An aggregation ran successfully but produced no rows. Distinct from an
 * empty {@code findMany}, which is a normal result.
 */
public class EmptyResultException extends ModelException {

    public EmptyResultException(String collection) {
        super("aggregate", collection, "pipeline produced no results", null);
    }
}
