package com.example.mongomodel.store.exception;

/**
 * Root of every failure raised by the model layer. Carries the name of the
 * operation that failed and, for collection operations, the collection name.
 */
public class ModelException extends RuntimeException {

    private final String operation;
    private final String collection;

    public ModelException(String operation, String collection, String message, Throwable cause) {
        super(describe(operation, collection, message), cause);
        this.operation = operation;
        this.collection = collection;
    }

    public String getOperation() {
        return operation;
    }

    /**
     * @return the bound collection, or {@code null} for database-level operations
     */
    public String getCollection() {
        return collection;
    }

    private static String describe(String operation, String collection, String message) {
        String target = collection == null ? operation : operation + " on " + collection;
        return message == null ? target + " failed" : target + " failed: " + message;
    }
}
