package com.example.mongomodel.store.exception;

public class ConnectionException extends ModelException {

    public ConnectionException(String databaseName, String message, Throwable cause) {
        super("connect", null, "database " + databaseName + ": " + message, cause);
    }
}
