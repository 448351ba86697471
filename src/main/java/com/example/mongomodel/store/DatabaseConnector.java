package com.example.mongomodel.store;

import com.example.mongomodel.store.exception.ConnectionException;
import com.example.mongomodel.store.options.DatabaseOptions;
import com.example.mongomodel.store.options.OptionsMerger;
import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoDatabase;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import org.bson.Document;
import org.bson.codecs.configuration.CodecRegistries;
import org.bson.codecs.configuration.CodecRegistry;
import org.bson.codecs.pojo.PojoCodecProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens a {@link MongoClient} and resolves one named database from it.
 *
 * <p>Without {@code clientSettings} the client is configured from {@code uri},
 * with a codec registry that maps plain Java classes automatically. Supplied
 * {@code clientSettings} replace that configuration entirely and the URI is
 * ignored.
 *
 * <p>The client stays with the connector until {@link #close()}, including when
 * {@link #connect()} fails after the client was created.
 */
@Getter
public class DatabaseConnector implements Connector<MongoDatabase> {

    private static final Logger logger = LoggerFactory.getLogger(DatabaseConnector.class);

    static final CodecRegistry POJO_CODEC_REGISTRY = CodecRegistries.fromRegistries(
            MongoClientSettings.getDefaultCodecRegistry(),
            CodecRegistries.fromProviders(PojoCodecProvider.builder().automatic(true).build()));

    private final String databaseName;
    private final String uri;
    private final DatabaseOptions databaseOptions;
    private final MongoClientSettings clientSettings;
    private final boolean verifyConnection;

    @Getter(AccessLevel.NONE)
    private MongoClient client;

    @Builder
    public DatabaseConnector(String databaseName,
                             String uri,
                             DatabaseOptions databaseOptions,
                             MongoClientSettings clientSettings,
                             boolean verifyConnection) {
        if (databaseName == null || databaseName.isBlank()) {
            throw new IllegalArgumentException("Database name must not be blank");
        }
        if (clientSettings == null && (uri == null || uri.isBlank())) {
            throw new IllegalArgumentException("Either a connection string or client settings are required");
        }
        this.databaseName = databaseName;
        this.uri = uri;
        this.databaseOptions = databaseOptions;
        this.clientSettings = clientSettings;
        this.verifyConnection = verifyConnection;
    }

    public DatabaseConnector(String databaseName, String uri) {
        this(databaseName, uri, null, null, false);
    }

    /**
     * @throws ConnectionException if the settings are invalid or the server cannot be reached
     * @throws IllegalStateException if this connector already holds an open client
     */
    @Override
    public synchronized MongoDatabase connect() {
        if (client != null) {
            throw new IllegalStateException("Connector for " + databaseName + " is already connected; close it first");
        }
        MongoClientSettings settings = resolveSettings();
        try {
            client = MongoClients.create(settings);
        } catch (MongoException | IllegalArgumentException e) {
            throw new ConnectionException(databaseName, "cannot create client", e);
        }

        MongoDatabase database = client.getDatabase(databaseName);
        if (databaseOptions != null) {
            database = OptionsMerger.applyTo(database, databaseOptions);
        }

        if (verifyConnection) {
            try {
                database.runCommand(new Document("ping", 1));
            } catch (MongoException e) {
                logger.warn("Ping against database {} failed: {}", databaseName, e.getMessage());
                throw new ConnectionException(databaseName, "server did not answer ping", e);
            }
        }
        logger.info("Connected to database {}", databaseName);
        return database;
    }

    /**
     * Releases the client, if any. Safe to call more than once; a closed
     * connector may connect again.
     */
    @Override
    public synchronized void close() {
        if (client == null) {
            return;
        }
        try {
            client.close();
            logger.info("Closed client for database {}", databaseName);
        } finally {
            client = null;
        }
    }

    /**
     * @return the client opened by {@link #connect()}, or {@code null} when not connected
     */
    public synchronized MongoClient getClient() {
        return client;
    }

    public synchronized boolean isConnected() {
        return client != null;
    }

    private MongoClientSettings resolveSettings() {
        if (clientSettings != null) {
            return clientSettings;
        }
        try {
            return MongoClientSettings.builder()
                    .applyConnectionString(new ConnectionString(uri))
                    .codecRegistry(POJO_CODEC_REGISTRY)
                    .build();
        } catch (IllegalArgumentException | MongoException e) {
            throw new ConnectionException(databaseName, "invalid connection string", e);
        }
    }
}
