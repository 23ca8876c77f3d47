import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.exceptions.DuplicateDefinitionException;
import io.github.flameyossnowy.associative.api.exceptions.UnknownScopeException;
import io.github.flameyossnowy.associative.api.exceptions.ValidationException;
import io.github.flameyossnowy.associative.api.options.AttributeRange;
import io.github.flameyossnowy.associative.api.options.SortOrder;
import io.github.flameyossnowy.associative.memory.RecordDatabase;
import io.github.flameyossnowy.associative.memory.ScopeEngine;
import io.github.flameyossnowy.associative.memory.Scopes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeEngineTest {
    VideoLibrary library;
    RecordDatabase database;
    ScopeEngine scopes;
    List<DataRecord> videos;

    @BeforeEach
    void setup() {
        library = VideoLibrary.seeded();
        database = library.database;
        scopes = database.scopes();
        videos = database.all("videos");
    }

    private static List<String> titles(List<DataRecord> records) {
        return records.stream().map(r -> r.getString("title")).toList();
    }

    @Test
    void durationMinThenSortByEngine() {
        List<DataRecord> result = scopes.applyScope(
            scopes.applyScope(videos, "videos", "duration_min", 100),
            "videos", "sort", "engine");

        assertEquals(List.of("Apple", "Banana", "Dog"), titles(result));
    }

    @Test
    void sequentialApplicationMatchesNestedFunctions() {
        List<DataRecord> nested = Scopes.order(
            Scopes.where(videos, "duration", AttributeRange.atLeast(100)), "engine");
        List<DataRecord> sequential = scopes.applyScope(
            scopes.applyScope(videos, "videos", "duration_min", 100),
            "videos", "order", "engine");

        assertEquals(nested, sequential);
    }

    @Test
    void orderIsStableForEqualKeys() {
        List<DataRecord> byEngine = scopes.applyScope(videos, "videos", "order", "engine");

        assertEquals(List.of("Apple", "Orange", "Banana", "Cat", "Dog"), titles(byEngine));
    }

    @Test
    void orderIsNumericForIntegers() {
        library.video("Eel", "vimeo", 1000);

        List<DataRecord> byDuration = Scopes.order(database.all("videos"), "duration");
        assertEquals(List.of("Orange", "Cat", "Dog", "Banana", "Apple", "Eel"), titles(byDuration));

        List<DataRecord> descending = scopes.applyScope(database.all("videos"), "videos", "order", "duration", SortOrder.DESCENDING);
        assertEquals("Eel", descending.get(0).getString("title"));
    }

    @Test
    void whereMatchesEqualityAcrossNumberTypes() {
        assertEquals(List.of("Dog"), titles(scopes.applyScope(videos, "videos", "where", "duration", 120)));
        assertEquals(List.of("Dog"), titles(scopes.applyScope(videos, "videos", "where", "duration", 120L)));
        assertEquals(List.of("Banana"), titles(scopes.applyScope(videos, "videos", "where", "engine", "vimeo")));
        assertEquals(List.of(), scopes.applyScope(videos, "videos", "where", "engine", "twitch"));
    }

    @Test
    void whereRangeIsInclusive() {
        List<DataRecord> between = Scopes.where(videos, "duration", AttributeRange.between(90, 140));
        assertEquals(List.of("Cat", "Dog", "Banana"), titles(between));

        List<DataRecord> atMost = Scopes.where(videos, "duration", AttributeRange.atMost(90));
        assertEquals(List.of("Cat", "Orange"), titles(atMost));

        List<DataRecord> atLeast = Scopes.where(videos, "duration", AttributeRange.atLeast(240));
        assertEquals(List.of("Apple"), titles(atLeast));
    }

    @Test
    void scopesDoNotMutateTheirInput() {
        List<DataRecord> before = List.copyOf(videos);

        scopes.applyScope(videos, "videos", "order", "title");
        scopes.applyScope(videos, "videos", "duration_min", 100);

        assertEquals(before, videos);
        assertEquals(90L, library.cat.getLong("duration"));
    }

    @Test
    void unknownScopeFails() {
        UnknownScopeException e = assertThrows(UnknownScopeException.class,
            () -> scopes.applyScope(videos, "videos", "popular"));
        assertEquals("popular", e.getScope());
        assertThrows(UnknownScopeException.class, () -> scopes.applyScope(videos, "playlists", "duration_min", 100));
    }

    @Test
    void duplicateOrReservedScopeNameFails() {
        assertThrows(DuplicateDefinitionException.class,
            () -> database.defineScope("videos", "sort", (records, args) -> records));
        assertThrows(DuplicateDefinitionException.class,
            () -> database.defineScope("videos", "order", (records, args) -> records));
        database.defineScope("playlists", "sort", (records, args) -> records);
    }

    @Test
    void builtInArgumentsAreChecked() {
        assertThrows(IllegalArgumentException.class, () -> scopes.applyScope(videos, "videos", "order"));
        assertThrows(IllegalArgumentException.class, () -> scopes.applyScope(videos, "videos", "where", "engine"));
        assertThrows(IllegalArgumentException.class, () -> scopes.applyScope(videos, "videos", "order", 5));
        assertThrows(IllegalArgumentException.class, () -> scopes.applyScope(videos, "videos", "order", "title", "DESC"));
        assertThrows(IllegalArgumentException.class, () -> scopes.applyScope(videos, "videos", "where", 3, "youtube"));
    }

    @Test
    void unknownAttributeFails() {
        assertThrows(ValidationException.class, () -> Scopes.order(videos, "views"));
    }

    @Test
    void mergeKeepsLeftOrderAndIsASubset() {
        List<DataRecord> right = List.of(library.orange, library.cat, library.animals);

        List<DataRecord> merged = Scopes.merge(videos, right);

        assertEquals(List.of(library.cat, library.orange), merged);
        assertTrue(videos.containsAll(merged));
    }
}
