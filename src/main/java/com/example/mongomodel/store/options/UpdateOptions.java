package com.example.mongomodel.store.options;

import com.mongodb.client.model.Collation;
import lombok.Builder;
import lombok.Value;
import org.bson.conversions.Bson;

import java.util.List;

import static com.example.mongomodel.store.options.OptionsMerger.overlay;

/**
 * Options shared by {@code updateOne} and {@code updateMany}.
 */
@Value
@Builder(toBuilder = true)
public class UpdateOptions implements Mergeable<UpdateOptions> {

    Boolean upsert;
    List<? extends Bson> arrayFilters;
    Collation collation;
    Bson hint;
    Boolean bypassDocumentValidation;
    String comment;

    public UpdateOptions(Boolean upsert,
                         List<? extends Bson> arrayFilters,
                         Collation collation,
                         Bson hint,
                         Boolean bypassDocumentValidation,
                         String comment) {
        this.upsert = upsert;
        this.arrayFilters = arrayFilters == null ? null : List.copyOf(arrayFilters);
        this.collation = collation;
        this.hint = hint;
        this.bypassDocumentValidation = bypassDocumentValidation;
        this.comment = comment;
    }

    public static UpdateOptions empty() {
        return UpdateOptions.builder().build();
    }

    @Override
    public UpdateOptions mergeWith(UpdateOptions override) {
        return new UpdateOptions(
                overlay(upsert, override.upsert),
                overlay(arrayFilters, override.arrayFilters),
                overlay(collation, override.collation),
                overlay(hint, override.hint),
                overlay(bypassDocumentValidation, override.bypassDocumentValidation),
                overlay(comment, override.comment));
    }

    public com.mongodb.client.model.UpdateOptions toDriverOptions() {
        com.mongodb.client.model.UpdateOptions options = new com.mongodb.client.model.UpdateOptions();
        if (upsert != null) {
            options.upsert(upsert);
        }
        if (arrayFilters != null) {
            options.arrayFilters(arrayFilters);
        }
        if (collation != null) {
            options.collation(collation);
        }
        if (hint != null) {
            options.hint(hint);
        }
        if (bypassDocumentValidation != null) {
            options.bypassDocumentValidation(bypassDocumentValidation);
        }
        if (comment != null) {
            options.comment(comment);
        }
        return options;
    }
}
