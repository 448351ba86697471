package com.example.mongomodel.store.options;

import com.mongodb.ReadConcern;
import com.mongodb.ReadConcernLevel;
import com.mongodb.ReadPreference;
import com.mongodb.WriteConcern;
import lombok.Builder;
import lombok.Value;
import org.bson.codecs.configuration.CodecRegistry;

import static com.example.mongomodel.store.options.OptionsMerger.overlay;

/**
 * Database-level settings applied when the connector resolves its database.
 */
@Value
@Builder(toBuilder = true)
public class DatabaseOptions implements Mergeable<DatabaseOptions> {

    ReadConcern readConcern;
    ReadPreference readPreference;
    WriteConcern writeConcern;
    CodecRegistry codecRegistry;

    public static DatabaseOptions empty() {
        return DatabaseOptions.builder().build();
    }

    /**
     * Builds options from their textual names, e.g. {@code "majority"},
     * {@code "secondaryPreferred"}, {@code "w1"}. Blank names leave the field unset.
     *
     * @throws IllegalArgumentException if a name is not recognised by the driver
     */
    public static DatabaseOptions parse(String readConcern, String readPreference, String writeConcern) {
        DatabaseOptionsBuilder builder = DatabaseOptions.builder();
        if (hasText(readConcern)) {
            builder.readConcern(new ReadConcern(ReadConcernLevel.fromString(readConcern.trim())));
        }
        if (hasText(readPreference)) {
            builder.readPreference(ReadPreference.valueOf(readPreference.trim()));
        }
        if (hasText(writeConcern)) {
            WriteConcern concern = WriteConcern.valueOf(writeConcern.trim());
            if (concern == null) {
                throw new IllegalArgumentException("Unknown write concern: " + writeConcern);
            }
            builder.writeConcern(concern);
        }
        return builder.build();
    }

    public boolean isEmpty() {
        return readConcern == null && readPreference == null && writeConcern == null && codecRegistry == null;
    }

    @Override
    public DatabaseOptions mergeWith(DatabaseOptions override) {
        return new DatabaseOptions(
                overlay(readConcern, override.readConcern),
                overlay(readPreference, override.readPreference),
                overlay(writeConcern, override.writeConcern),
                overlay(codecRegistry, override.codecRegistry));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
