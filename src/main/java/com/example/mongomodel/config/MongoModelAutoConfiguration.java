package com.example.mongomodel.config;

import com.example.mongomodel.store.DatabaseConnector;
import com.example.mongomodel.store.options.DatabaseOptions;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Wires a {@link DatabaseConnector} and its {@link MongoDatabase} from
 * {@code app.mongodb.*} properties. The application context owns the client and
 * closes it on shutdown.
 *
 * <p>The connector's client is published as the {@link MongoClient} bean so that
 * Boot's own {@link MongoAutoConfiguration} backs off instead of opening a
 * second client.
 */
@AutoConfiguration(before = MongoAutoConfiguration.class)
@ConditionalOnProperty(prefix = "app.mongodb", name = "uri")
public class MongoModelAutoConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(MongoModelAutoConfiguration.class);

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public DatabaseConnector databaseConnector(
            @Value("${app.mongodb.uri}") String uri,
            @Value("${app.mongodb.database}") String database,
            @Value("${app.mongodb.read-concern:}") String readConcern,
            @Value("${app.mongodb.read-preference:}") String readPreference,
            @Value("${app.mongodb.write-concern:}") String writeConcern,
            @Value("${app.mongodb.verify-connection:false}") boolean verifyConnection) {
        DatabaseOptions options = DatabaseOptions.parse(readConcern, readPreference, writeConcern);
        logger.debug("Configuring connector for database {} (verify={})", database, verifyConnection);
        return DatabaseConnector.builder()
                .databaseName(database)
                .uri(uri)
                .databaseOptions(options.isEmpty() ? null : options)
                .verifyConnection(verifyConnection)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public MongoDatabase mongoDatabase(DatabaseConnector connector) {
        return connector.connect();
    }

    /**
     * The connector stays the owner of this client, hence no destroy method.
     * Depends on the database bean so the client exists before it is exposed.
     */
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public MongoClient mongoClient(DatabaseConnector connector, MongoDatabase mongoDatabase) {
        logger.debug("Exposing client of database {} as MongoClient bean", mongoDatabase.getName());
        return connector.getClient();
    }
}
