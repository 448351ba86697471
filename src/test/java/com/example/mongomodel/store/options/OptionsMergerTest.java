package com.example.mongomodel.store.options;

import com.mongodb.ReadConcern;
import com.mongodb.ReadPreference;
import com.mongodb.WriteConcern;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.Sorts;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OptionsMergerTest {

    @Mock
    private MongoDatabase database;

    @Mock
    private MongoDatabase secondaryView;

    @Mock
    private MongoDatabase majorityView;

    @Mock
    private FindIterable<Document> iterable;

    @Test
    void testMerge_NoOverridesReturnsDefaults() {
        FindManyOptions defaults = FindManyOptions.empty();

        assertSame(defaults, OptionsMerger.merge(defaults));
        assertSame(defaults, OptionsMerger.merge(defaults, (FindManyOptions[]) null));
    }

    @Test
    void testMerge_SingleOverrideTakesEffect() {
        FindManyOptions override = FindManyOptions.builder().limit(5).build();

        FindManyOptions effective = OptionsMerger.merge(FindManyOptions.empty(), override);

        assertEquals(5, effective.getLimit());
        assertNull(effective.getSkip());
    }

    @Test
    void testMerge_LastNonNullValueWins() {
        Bson byName = Sorts.ascending("name");
        FindManyOptions first = FindManyOptions.builder().skip(1).limit(10).sort(byName).build();
        FindManyOptions second = FindManyOptions.builder().skip(5).build();
        FindManyOptions third = FindManyOptions.builder().limit(20).build();

        FindManyOptions effective = OptionsMerger.merge(FindManyOptions.empty(), first, second, third);

        assertEquals(5, effective.getSkip());
        assertEquals(20, effective.getLimit());
        assertSame(byName, effective.getSort());
    }

    @Test
    void testMerge_NullOverridesAreSkipped() {
        UpdateOptions upsert = UpdateOptions.builder().upsert(true).build();

        UpdateOptions effective = OptionsMerger.merge(UpdateOptions.empty(), upsert, null);

        assertTrue(effective.getUpsert());
    }

    @Test
    void testMerge_DatabaseOptionsKeepUnsetFields() {
        DatabaseOptions base = DatabaseOptions.builder()
                .readPreference(ReadPreference.primary())
                .writeConcern(WriteConcern.W1)
                .build();
        DatabaseOptions override = DatabaseOptions.builder()
                .writeConcern(WriteConcern.MAJORITY)
                .build();

        DatabaseOptions effective = OptionsMerger.merge(base, override);

        assertEquals(ReadPreference.primary(), effective.getReadPreference());
        assertEquals(WriteConcern.MAJORITY, effective.getWriteConcern());
        assertNull(effective.getReadConcern());
    }

    @Test
    void testApplyTo_SetsOnlyConfiguredFields() {
        when(database.withReadPreference(ReadPreference.secondary())).thenReturn(secondaryView);
        when(secondaryView.withWriteConcern(WriteConcern.MAJORITY)).thenReturn(majorityView);

        MongoDatabase configured = OptionsMerger.applyTo(database, DatabaseOptions.builder()
                .readPreference(ReadPreference.secondary())
                .writeConcern(WriteConcern.MAJORITY)
                .build());

        assertSame(majorityView, configured);
        verify(database, never()).withReadConcern(any());
        verify(database, never()).withCodecRegistry(any());
    }

    @Test
    void testApplyTo_EmptyOptionsLeaveDatabaseUntouched() {
        assertSame(database, OptionsMerger.applyTo(database, DatabaseOptions.empty()));
        assertSame(database, OptionsMerger.applyTo(database, null));
        verifyNoInteractions(database);
    }

    @Test
    void testParse_ReadsDriverNames() {
        DatabaseOptions options = DatabaseOptions.parse("majority", "secondaryPreferred", "w1");

        assertEquals(ReadConcern.MAJORITY, options.getReadConcern());
        assertEquals(ReadPreference.secondaryPreferred(), options.getReadPreference());
        assertEquals(WriteConcern.W1, options.getWriteConcern());
    }

    @Test
    void testParse_BlankNamesLeaveFieldsUnset() {
        assertTrue(DatabaseOptions.parse("", " ", null).isEmpty());
    }

    @Test
    void testParse_UnknownNamesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> DatabaseOptions.parse(null, null, "sometimes"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseOptions.parse(null, "closest", null));
    }

    @Test
    void testFindManyOptions_ApplyToConfiguresIterable() {
        when(iterable.limit(25)).thenReturn(iterable);
        when(iterable.maxTime(1500, TimeUnit.MILLISECONDS)).thenReturn(iterable);

        FindManyOptions.builder()
                .limit(25)
                .maxTime(Duration.ofMillis(1500))
                .build()
                .applyTo(iterable);

        verify(iterable).limit(25);
        verify(iterable).maxTime(1500, TimeUnit.MILLISECONDS);
        verify(iterable, never()).skip(anyInt());
    }

    @Test
    void testUpdateOptions_ToDriverOptions() {
        List<Bson> arrayFilters = List.of(Filters.gte("elem.grade", 85));

        com.mongodb.client.model.UpdateOptions driverOptions = UpdateOptions.builder()
                .upsert(true)
                .arrayFilters(arrayFilters)
                .comment("nightly")
                .build()
                .toDriverOptions();

        assertTrue(driverOptions.isUpsert());
        assertEquals(arrayFilters, driverOptions.getArrayFilters());
        assertNull(driverOptions.getHint());
    }

    @Test
    void testUpdateOptions_ArrayFiltersAreCopied() {
        List<Bson> arrayFilters = new ArrayList<>();
        arrayFilters.add(Filters.gte("elem.grade", 85));

        UpdateOptions options = UpdateOptions.builder().arrayFilters(arrayFilters).build();
        arrayFilters.add(Filters.lt("elem.grade", 10));

        assertEquals(1, options.getArrayFilters().size());
        assertThrows(UnsupportedOperationException.class, () -> options.getArrayFilters().clear());
    }
}
