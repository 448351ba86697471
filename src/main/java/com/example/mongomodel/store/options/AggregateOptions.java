package com.example.mongomodel.store.options;

import com.mongodb.client.AggregateIterable;
import com.mongodb.client.model.Collation;
import lombok.Builder;
import lombok.Value;
import org.bson.conversions.Bson;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static com.example.mongomodel.store.options.OptionsMerger.overlay;

/**
 * Options for an aggregation. {@code maxTime} carries the caller's deadline to the server.
 */
@Value
@Builder(toBuilder = true)
public class AggregateOptions implements Mergeable<AggregateOptions> {

    Duration maxTime;
    Integer batchSize;
    Collation collation;
    Bson hint;
    Boolean allowDiskUse;
    String comment;

    public static AggregateOptions empty() {
        return AggregateOptions.builder().build();
    }

    @Override
    public AggregateOptions mergeWith(AggregateOptions override) {
        return new AggregateOptions(
                overlay(maxTime, override.maxTime),
                overlay(batchSize, override.batchSize),
                overlay(collation, override.collation),
                overlay(hint, override.hint),
                overlay(allowDiskUse, override.allowDiskUse),
                overlay(comment, override.comment));
    }

    public <R> AggregateIterable<R> applyTo(AggregateIterable<R> iterable) {
        AggregateIterable<R> configured = iterable;
        if (maxTime != null) {
            configured = configured.maxTime(maxTime.toMillis(), TimeUnit.MILLISECONDS);
        }
        if (batchSize != null) {
            configured = configured.batchSize(batchSize);
        }
        if (collation != null) {
            configured = configured.collation(collation);
        }
        if (hint != null) {
            configured = configured.hint(hint);
        }
        if (allowDiskUse != null) {
            configured = configured.allowDiskUse(allowDiskUse);
        }
        if (comment != null) {
            configured = configured.comment(comment);
        }
        return configured;
    }
}
