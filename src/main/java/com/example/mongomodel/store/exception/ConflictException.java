package com.example.mongomodel.store.exception;

/**
 * A write violated a unique index.
 */
public class ConflictException extends StoreExecutionException {

    public ConflictException(String operation, String collection, Throwable cause) {
        super(operation, collection, cause);
    }
}
