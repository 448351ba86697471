package com.example.mongomodel.store.exception;

/**
 * The stored encoding could not populate the requested type.
 */
public class DecodeException extends ModelException {

    private final Class<?> targetType;

    public DecodeException(String operation, String collection, Class<?> targetType, Throwable cause) {
        super(operation, collection, "cannot decode into " + targetType.getName() + ": " + cause.getMessage(), cause);
        this.targetType = targetType;
    }

    public Class<?> getTargetType() {
        return targetType;
    }
}
