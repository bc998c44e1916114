package de.caluga.test.dataapi.query;

import de.caluga.dataapi.driver.Doc;
import de.caluga.dataapi.driver.serdes.DataApiJson;
import de.caluga.dataapi.events.HierarchicalEmitter;
import de.caluga.dataapi.query.DistinctHelper;
import de.caluga.dataapi.query.FindCursor;
import de.caluga.test.dataapi.support.ManualTimeSource;
import de.caluga.test.dataapi.support.MockFetcher;
import de.caluga.test.dataapi.support.TestClients;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("inmemory")
public class DistinctHelperTest {

    private List<Object> distinct(String key, List<Map<String, Object>> docs) {
        MockFetcher fetcher = new MockFetcher();
        fetcher.enqueue(Doc.of("data", Doc.of("documents", docs, "nextPageState", null)));
        DistinctHelper helper = new DistinctHelper(key, new DataApiJson());
        FindCursor<Map<String, Object>> cursor = new FindCursor<>(
            TestClients.dataApiClient(fetcher, new ManualTimeSource(), new HierarchicalEmitter(null)), null, "c", null);
        cursor.project(helper.projection());
        return helper.distinct(cursor);
    }

    @Test
    public void distinctTagsInFirstSeenOrder() {
        List<Object> ret = distinct("tags", List.of(
                Doc.of("tags", List.of("a", "b")),
                Doc.of("tags", List.of("b")),
                Doc.of("tags", List.of("a"))));
        assertThat(ret).containsExactly("a", "b");
    }

    @Test
    public void objectsAreComparedByContent() {
        List<Object> ret = distinct("owner", List.of(
                Doc.of("owner", Doc.of("name", "x", "age", 1)),
                Doc.of("owner", Doc.of("age", 1, "name", "x")),
                Doc.of("owner", "x"),
                Doc.of("other", 1)));
        assertThat(ret).hasSize(2);
        assertThat(ret.get(0)).isEqualTo(Map.of("name", "x", "age", 1));
        assertThat(ret.get(1)).isEqualTo("x");
    }

    @Test
    public void nestedPathsThroughArrays() {
        DistinctHelper helper = new DistinctHelper("items.name", new DataApiJson());
        Map<String, Object> doc = Doc.of("items", List.of(Doc.of("name", "n1"), Doc.of("name", "n2"), Doc.of("x", 1)));
        assertThat(helper.extract(doc)).containsExactly("n1", "n2");

        helper = new DistinctHelper("items.1.name", new DataApiJson());
        assertThat(helper.extract(doc)).containsExactly("n2");
        assertThat(helper.projectionPath()).isEqualTo("items");

        helper = new DistinctHelper("items.7.name", new DataApiJson());
        assertThat(helper.extract(doc)).isEmpty();
    }

    @Test
    public void explicitNullIsADistinctValue() {
        List<Object> ret = distinct("a", List.of(
                Doc.of("a", null),
                Doc.of("a", 1),
                Doc.of("b", 2),
                Doc.of("a", null)));
        assertThat(ret).containsExactly(null, 1);

        DistinctHelper helper = new DistinctHelper("a.b", new DataApiJson());
        assertThat(helper.extract(Doc.of("a", null))).isEmpty();
        assertThat(helper.extract(Doc.of("a", Doc.of("b", null)))).containsExactly((Object) null);
        assertThat(helper.extract(Doc.of("a", List.of(Doc.of("b", 1), Doc.of("c", 2))))).containsExactly(1);
    }

    @Test
    public void projectionStopsAtFirstIndex() {
        assertThat(new DistinctHelper("a.0.b", new DataApiJson()).projection()).isEqualTo(Doc.of("_id", 0, "a", 1));
        assertThat(new DistinctHelper("_id", new DataApiJson()).projection()).isEqualTo(Doc.of("_id", 1));
        assertThat(new DistinctHelper("a.b.c", new DataApiJson()).projectionPath()).isEqualTo("a.b.c");
    }

    @Test
    public void emptySegmentsAreRejected() {
        assertThatThrownBy(() -> DistinctHelper.parsePath("a..b"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Path cannot contain empty segments");
        assertThatThrownBy(() -> DistinctHelper.parsePath(".a")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DistinctHelper.parsePath("")).isInstanceOf(IllegalArgumentException.class);
        assertThat(DistinctHelper.parsePath("a.b")).containsExactly("a", "b");
    }
}
