import io.github.flameyossnowy.associative.api.DataRecord;
import io.github.flameyossnowy.associative.api.exceptions.EmptyResultException;
import io.github.flameyossnowy.associative.api.exceptions.RecordNotFoundException;
import io.github.flameyossnowy.associative.api.exceptions.UnknownAssociationException;
import io.github.flameyossnowy.associative.api.exceptions.UnknownKindException;
import io.github.flameyossnowy.associative.api.exceptions.UnknownScopeException;
import io.github.flameyossnowy.associative.api.exceptions.ValidationException;
import io.github.flameyossnowy.associative.api.options.AttributeRange;
import io.github.flameyossnowy.associative.api.options.SortOrder;
import io.github.flameyossnowy.associative.api.scope.ScopeFunction;
import io.github.flameyossnowy.associative.memory.RecordDatabase;
import io.github.flameyossnowy.associative.memory.query.QueryOperation;
import io.github.flameyossnowy.associative.memory.query.QueryPlan;
import io.github.flameyossnowy.associative.memory.query.QueryState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class QueryPlanTest {
    VideoLibrary library;
    RecordDatabase database;

    @BeforeEach
    void setup() {
        library = VideoLibrary.seeded();
        database = library.database;
    }

    private static List<String> titles(List<DataRecord> records) {
        return records.stream().map(r -> r.getString("title")).toList();
    }

    @Test
    void durationMinThenSortByEngine() {
        List<DataRecord> result = database.query("videos")
            .scope("duration_min", 100)
            .scope("sort", "engine")
            .toList();

        assertEquals(List.of("Apple", "Banana", "Dog"), titles(result));
    }

    @Test
    void builtInWhereAndOrderChain() {
        List<DataRecord> result = database.query("videos")
            .where("duration", AttributeRange.atLeast(100))
            .order("engine")
            .toList();

        assertEquals(List.of("Apple", "Banana", "Dog"), titles(result));
    }

    @Test
    void playlistAveragesThroughListScope() {
        double animals = database.query("videos").scope("list", "Animals").average("duration");
        double fruits = database.query("videos").scope("list", "Fruits").average("duration");

        assertEquals(105.0d, animals, 1e-9);
        assertEquals(136L, (long) fruits);
        assertEquals(410.0d / 3, fruits, 1e-9);
    }

    @Test
    void playlistAveragesThroughJoin() {
        double animals = database.query("playlists").where("name", "Animals").join("videos").average("duration");

        assertEquals(105.0d, animals, 1e-9);
    }

    @Test
    void mergeWithJoinedPlanFiltersByRelatedKind() {
        QueryPlan fruitVideos = database.query("playlists").where("name", "Fruits").join("videos");

        List<DataRecord> result = database.query("videos")
            .order("title")
            .merge(fruitVideos)
            .toList();

        assertEquals(List.of("Apple", "Banana", "Orange"), titles(result));
        assertEquals(QueryState.BUILT, fruitVideos.state());
    }

    @Test
    void mergeWithRecordsIsSubsetInLeftOrder() {
        List<DataRecord> result = database.query("videos")
            .order("duration", SortOrder.DESCENDING)
            .merge(List.of(library.cat, library.apple, library.orange))
            .toList();

        assertEquals(List.of(library.apple, library.cat, library.orange), result);
    }

    @Test
    void mergeOfDifferentKindFails() {
        QueryPlan playlists = database.query("playlists");

        assertThrows(IllegalArgumentException.class, () -> database.query("videos").merge(playlists));
    }

    @Test
    void joinFlattensInSourceOrderAndKeepsDuplicates() {
        database.collection(library.animals, "videos").append(library.cat);

        List<DataRecord> result = database.query("playlists").join("videos").toList();

        assertEquals(List.of("Cat", "Dog", "Cat", "Banana", "Apple", "Orange"), titles(result));
    }

    @Test
    void joinChangesTheCurrentKind() {
        QueryPlan plan = database.query("videos").where("title", "Cat").join("playlists");

        assertEquals("videos", plan.baseKind());
        assertEquals("playlists", plan.currentKind());
        assertEquals(library.animals, plan.first());
    }

    @Test
    void joinThroughOneToOneChain() {
        List<DataRecord> liked = database.query("playlists")
            .where("name", "Fruits")
            .join("likes")
            .join("video")
            .order("duration")
            .toList();

        assertEquals(List.of("Orange", "Banana", "Apple"), titles(liked));
    }

    @Test
    void aggregatesOnEmptyResults() {
        QueryPlan empty = database.query("videos").where("engine", "twitch");

        assertEquals(0L, database.query("videos").where("engine", "twitch").count());
        assertEquals(0.0d, database.query("videos").where("engine", "twitch").average("duration"));
        assertEquals(0.0d, database.query("videos").where("engine", "twitch").sum("duration"));
        assertThrows(EmptyResultException.class, empty::first);
    }

    @Test
    void countAndFirst() {
        assertEquals(5L, database.query("videos").count());
        assertEquals(library.orange, database.query("videos").order("duration").first());
        assertEquals(270.0d, database.query("videos").where("engine", "dailymotion").sum("duration"), 1e-9);
    }

    @Test
    void limitTruncatesAfterOrdering() {
        List<DataRecord> longest = database.query("videos").order("duration", SortOrder.DESCENDING).limit(2).toList();

        assertEquals(List.of("Apple", "Banana"), titles(longest));
        assertThrows(IllegalArgumentException.class, () -> database.query("videos").limit(-1));
    }

    @Test
    void planIsIterable() {
        List<String> seen = new ArrayList<>();
        for (DataRecord record : database.query("videos").where("engine", "youtube")) {
            seen.add(record.getString("title"));
        }

        assertEquals(List.of("Cat", "Dog"), seen);
    }

    @Test
    void chainingReturnsNewPlansAndLeavesTheBaseUntouched() {
        QueryPlan base = database.query("videos").scope("duration_min", 100);
        QueryPlan byTitle = base.order("title");
        QueryPlan byEngine = base.order("engine");

        assertEquals(1, base.operations().size());
        assertEquals(List.of("Apple", "Banana", "Dog"), titles(byTitle.toList()));
        assertEquals(List.of("Apple", "Banana", "Dog"), titles(byEngine.toList()));
        assertEquals(QueryState.BUILT, base.state());
    }

    @Test
    void materializedPlanCannotBeReused() {
        QueryPlan plan = database.query("videos").order("title");

        plan.toList();

        assertEquals(QueryState.MATERIALIZED, plan.state());
        assertThrows(IllegalStateException.class, plan::count);
        assertThrows(IllegalStateException.class, () -> plan.where("engine", "vimeo"));
        assertThrows(IllegalStateException.class, () -> database.query("videos").merge(plan));
    }

    @Test
    void scopesRunOnlyWhenMaterialized() {
        ScopeFunction tracked = mock(ScopeFunction.class);
        when(tracked.apply(any(), any())).thenAnswer(invocation -> invocation.getArgument(0));
        database.defineScope("videos", "tracked", tracked);

        QueryPlan plan = database.query("videos").scope("tracked").order("title");
        verifyNoInteractions(tracked);

        assertEquals(5L, plan.count());
        verify(tracked, times(1)).apply(any(), any());
    }

    @Test
    void plansSeeRecordsInsertedAfterTheyWereBuilt() {
        QueryPlan youtube = database.query("videos").where("engine", "youtube");

        library.video("Cow", "youtube", 75);

        assertEquals(3L, youtube.count());
    }

    @Test
    void buildTimeValidation() {
        assertThrows(UnknownKindException.class, () -> database.query("songs"));
        assertThrows(UnknownScopeException.class, () -> database.query("videos").scope("popular"));
        assertThrows(UnknownScopeException.class, () -> database.query("playlists").scope("duration_min", 10));
        assertThrows(UnknownAssociationException.class, () -> database.query("videos").join("authors"));
        assertThrows(ValidationException.class, () -> database.query("videos").where("views", 3));
        assertThrows(ValidationException.class, () -> database.query("videos").order("views"));
        assertThrows(ValidationException.class, () -> database.query("videos").average("title"));
        assertThrows(ValidationException.class, () -> database.query("videos").scope("where", "views", 3));
        assertThrows(ValidationException.class, () -> database.query("videos").scope("order", "views"));
        assertThrows(IllegalArgumentException.class, () -> database.query("videos").scope("order", 5));
        assertThrows(IllegalArgumentException.class, () -> database.query("videos").scope("order", "title", "DESC"));
        assertThrows(IllegalArgumentException.class, () -> database.query("videos").scope("where", "engine"));
    }

    @Test
    void builtInScopesMatchTheirChainingMethods() {
        QueryPlan viaScopes = database.query("videos")
            .scope("where", "engine", "dailymotion")
            .scope("order", "duration", SortOrder.DESCENDING);

        assertEquals(2, viaScopes.operations().size());
        assertInstanceOf(QueryOperation.Filter.class, viaScopes.operations().get(0));
        assertEquals(List.of("Apple", "Orange"), titles(viaScopes.toList()));
    }

    @Test
    void failedEvaluationLeavesThePlanReusable() {
        QueryPlan liked = database.query("likes").join("video");
        database.delete(library.cat);

        assertThrows(RecordNotFoundException.class, liked::toList);
        assertEquals(QueryState.BUILT, liked.state());

        DataRecord danglingLike = database.query("likes").where("video_id", library.cat.id()).first();
        database.delete(danglingLike);

        assertEquals(4L, liked.count());
        assertEquals(QueryState.MATERIALIZED, liked.state());
    }
}
