package com.example.mongomodel.store.options;

import com.mongodb.client.FindIterable;
import com.mongodb.client.model.Collation;
import lombok.Builder;
import lombok.Value;
import org.bson.conversions.Bson;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static com.example.mongomodel.store.options.OptionsMerger.overlay;

@Value
@Builder(toBuilder = true)
public class FindManyOptions implements Mergeable<FindManyOptions> {

    Bson projection;
    Bson sort;
    Integer skip;
    Integer limit;
    Integer batchSize;
    Duration maxTime;
    Collation collation;
    Bson hint;
    String comment;

    public static FindManyOptions empty() {
        return FindManyOptions.builder().build();
    }

    @Override
    public FindManyOptions mergeWith(FindManyOptions override) {
        return new FindManyOptions(
                overlay(projection, override.projection),
                overlay(sort, override.sort),
                overlay(skip, override.skip),
                overlay(limit, override.limit),
                overlay(batchSize, override.batchSize),
                overlay(maxTime, override.maxTime),
                overlay(collation, override.collation),
                overlay(hint, override.hint),
                overlay(comment, override.comment));
    }

    public <T> FindIterable<T> applyTo(FindIterable<T> iterable) {
        FindIterable<T> configured = iterable;
        if (projection != null) {
            configured = configured.projection(projection);
        }
        if (sort != null) {
            configured = configured.sort(sort);
        }
        if (skip != null) {
            configured = configured.skip(skip);
        }
        if (limit != null) {
            configured = configured.limit(limit);
        }
        if (batchSize != null) {
            configured = configured.batchSize(batchSize);
        }
        if (maxTime != null) {
            configured = configured.maxTime(maxTime.toMillis(), TimeUnit.MILLISECONDS);
        }
        if (collation != null) {
            configured = configured.collation(collation);
        }
        if (hint != null) {
            configured = configured.hint(hint);
        }
        if (comment != null) {
            configured = configured.comment(comment);
        }
        return configured;
    }
}
