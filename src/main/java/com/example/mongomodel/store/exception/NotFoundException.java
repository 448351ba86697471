package com.example.mongomodel.store.exception;

/**
 * Thrown by {@code findOne} when no document matches the filter.
 */
public class NotFoundException extends ModelException {

    public NotFoundException(String operation, String collection) {
        super(operation, collection, "no document matches the filter", null);
    }
}
