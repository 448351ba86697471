package com.example.mongomodel.store;

/**
 * Establishes a connection and hands out the connected resource. The connector
 * owns whatever it opened until {@link #close()} is called.
 *
 * @param <R> the connected resource
 */
public interface Connector<R> extends AutoCloseable {

    R connect();

    @Override
    void close();
}
