package com.example.mongomodel.store.options;

import com.mongodb.client.MongoDatabase;

/**
 * Reduces per-call option objects to the single effective set handed to the driver.
 *
 * <p>Rule: starting from the defaults, each supplied override is applied in order
 * and every non-null field it carries replaces the earlier value, so the last
 * non-null value wins. Null overrides are skipped.
 */
public final class OptionsMerger {

    private OptionsMerger() {
    }

    @SafeVarargs
    public static <O extends Mergeable<O>> O merge(O defaults, O... overrides) {
        O effective = defaults;
        if (overrides == null) {
            return effective;
        }
        for (O override : overrides) {
            if (override != null) {
                effective = effective.mergeWith(override);
            }
        }
        return effective;
    }

    /**
     * Returns a view of {@code database} carrying every non-null setting of
     * {@code options}. Unset fields keep the client defaults.
     */
    public static MongoDatabase applyTo(MongoDatabase database, DatabaseOptions options) {
        if (options == null) {
            return database;
        }
        MongoDatabase configured = database;
        if (options.getCodecRegistry() != null) {
            configured = configured.withCodecRegistry(options.getCodecRegistry());
        }
        if (options.getReadConcern() != null) {
            configured = configured.withReadConcern(options.getReadConcern());
        }
        if (options.getReadPreference() != null) {
            configured = configured.withReadPreference(options.getReadPreference());
        }
        if (options.getWriteConcern() != null) {
            configured = configured.withWriteConcern(options.getWriteConcern());
        }
        return configured;
    }

    static <V> V overlay(V current, V override) {
        return override != null ? override : current;
    }
}
