package com.example.mongomodel.store.exception;

/**
 * The server or the driver rejected an operation.
 */
public class StoreExecutionException extends ModelException {

    public StoreExecutionException(String operation, String collection, Throwable cause) {
        super(operation, collection, cause.getMessage(), cause);
    }
}
