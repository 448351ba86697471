package com.example.mongomodel.store.options;

import com.mongodb.client.FindIterable;
import com.mongodb.client.model.Collation;
import lombok.Builder;
import lombok.Value;
import org.bson.conversions.Bson;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static com.example.mongomodel.store.options.OptionsMerger.overlay;

/**
 * Options for a single-document lookup. {@code sort} and {@code skip} decide
 * which match counts as the first one.
 */
@Value
@Builder(toBuilder = true)
public class FindOneOptions implements Mergeable<FindOneOptions> {

    Bson projection;
    Bson sort;
    Integer skip;
    Duration maxTime;
    Collation collation;
    Bson hint;
    String comment;

    public static FindOneOptions empty() {
        return FindOneOptions.builder().build();
    }

    @Override
    public FindOneOptions mergeWith(FindOneOptions override) {
        return new FindOneOptions(
                overlay(projection, override.projection),
                overlay(sort, override.sort),
                overlay(skip, override.skip),
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
