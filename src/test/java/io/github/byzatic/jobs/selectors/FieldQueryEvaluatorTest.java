package io.github.byzatic.jobs.selectors;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import io.github.byzatic.jobs.catalog.InMemoryCatalog;
import io.github.byzatic.jobs.model.Node;
import io.github.byzatic.jobs.model.Query;
import io.github.byzatic.jobs.model.User;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class FieldQueryEvaluatorTest {

    private static Node node(String path, Map<String, String> meta) {
        return Node.newBuilder().setUuid(path.hashCode() + "").setPath(path).setType(Node.Type.LEAF).setMetadata(meta).build();
    }

    @Test
    void operatorsMatchFields() throws Exception {
        FieldQueryEvaluator<Node> e = FieldQueryEvaluator.forNodes(null, 10);
        Node n = node("docs/report.pdf", ImmutableMap.of("owner", "alice"));
        assertTrue(e.compile(Query.of("path=docs/report.pdf")).test(n));
        assertTrue(e.compile(Query.of("path^=docs/")).test(n));
        assertTrue(e.compile(Query.of("path*=report")).test(n));
        assertTrue(e.compile(Query.of("meta.owner!=bob")).test(n));
        assertTrue(e.compile(Query.of("type=LEAF")).test(n));
        assertFalse(e.compile(Query.of("meta.missing=x")).test(n));
    }

    @Test
    void andOrCombination() throws Exception {
        FieldQueryEvaluator<User> e = FieldQueryEvaluator.forUsers(null, 10);
        User u = new User("u1", "alice", "/staff", ImmutableMap.of("lang", "fr"));
        Predicate<User> or = e.compile(Query.of("login=bob", "group=/staff"));
        Predicate<User> and = e.compile(Query.allOf("login=bob", "group=/staff"));
        assertTrue(or.test(u));
        assertFalse(and.test(u));
        assertTrue(e.compile(Query.allOf("attr.lang=fr", "login^=al")).test(u));
    }

    @Test
    void selectAppliesOffsetAndLimit() throws Exception {
        InMemoryCatalog<Node> catalog = InMemoryCatalog.ofNodes();
        for (int i = 0; i < 10; i++) catalog.add(node("p" + i, Map.of()));
        FieldQueryEvaluator<Node> e = FieldQueryEvaluator.forNodes(catalog, 3);
        List<Node> out = Lists.newArrayList(e.select(new Query(List.of("path^=p"), Query.Operation.OR, 2, 3)));
        assertEquals(List.of("p2", "p3", "p4"), out.stream().map(Node::getPath).collect(Collectors.toList()));
    }

    @Test
    void malformedTermsAndMissingCatalogFail() {
        FieldQueryEvaluator<Node> e = FieldQueryEvaluator.forNodes(null, 10);
        assertThrows(ConfigurationException.class, () -> e.compile(Query.of("pathdocs")));
        assertThrows(ConfigurationException.class, () -> e.compile(Query.of("=docs")));
        assertThrows(ConfigurationException.class, () -> e.select(Query.of("path=docs")));
    }
}
