package io.github.byzatic.jobs.selectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import io.github.byzatic.jobs.catalog.InMemoryCatalog;
import io.github.byzatic.jobs.model.ActionMessage;
import io.github.byzatic.jobs.model.ActionOutput;
import io.github.byzatic.jobs.model.Node;
import io.github.byzatic.jobs.model.Query;
import io.github.byzatic.jobs.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SelectorResolverTest {
    InMemoryCatalog<Node> nodes;
    InMemoryCatalog<User> users;
    SelectorResolver resolver;

    @BeforeEach
    void setUp() {
        nodes = InMemoryCatalog.ofNodes();
        for (int i = 0; i < 25; i++) {
            nodes.add(Node.newBuilder().setUuid("n" + i).setPath((i % 2 == 0 ? "docs/" : "media/") + "file" + i)
                    .setType(Node.Type.LEAF).build());
        }
        users = InMemoryCatalog.ofUsers();
        users.add(new User("u1", "alice"), new User("u2", "bob"), new User("u3", "carol"));
        resolver = SelectorResolver.newBuilder().nodeCatalog(nodes).userCatalog(users).pageSize(7).build();
    }

    private static List<Node> nodesOf(Targets targets, ActionMessage inbound) {
        return Lists.newArrayList(targets.invocations(inbound)).stream()
                .flatMap(m -> m.getNodes().stream())
                .collect(Collectors.toList());
    }

    @Test
    void allIsStableAcrossResolutions() throws Exception {
        NodesSelector all = NodesSelector.newBuilder().all(true).query(Query.of("path^=docs/")).build();
        List<Node> first = nodesOf(resolver.resolve(all, null, ActionMessage.empty()), ActionMessage.empty());
        List<Node> second = nodesOf(resolver.resolve(all, null, ActionMessage.empty()), ActionMessage.empty());
        assertEquals(25, first.size());
        assertEquals(first, second);
    }

    @Test
    void perEntityModeYieldsOneMessagePerNode() throws Exception {
        NodesSelector all = NodesSelector.newBuilder().all(true).build();
        List<ActionMessage> messages = Lists.newArrayList(resolver.resolve(all, null, ActionMessage.empty()).invocations(ActionMessage.empty()));
        assertEquals(25, messages.size());
        messages.forEach(m -> assertEquals(1, m.getNodes().size()));
    }

    @Test
    void collectModeYieldsOneMessageWithEverything() throws Exception {
        NodesSelector all = NodesSelector.newBuilder().all(true).collect(true).build();
        List<ActionMessage> messages = Lists.newArrayList(resolver.resolve(all, null, ActionMessage.empty()).invocations(ActionMessage.empty()));
        assertEquals(1, messages.size());
        assertEquals(25, messages.get(0).getNodes().size());
    }

    @Test
    void presetIsReturnedVerbatimInOrder() throws Exception {
        Node custom = Node.newBuilder().setUuid("x").setPath("somewhere/else").build();
        NodesSelector preset = NodesSelector.newBuilder()
                .nodes(List.of(custom))
                .paths("media/file3", "missing/path", "docs/file0")
                .query(Query.of("path=ignored"))
                .build();
        List<Node> out = nodesOf(resolver.resolve(preset, null, ActionMessage.empty()), ActionMessage.empty());
        assertEquals(List.of("somewhere/else", "media/file3", "missing/path", "docs/file0"),
                out.stream().map(Node::getPath).collect(Collectors.toList()));
        assertEquals("n3", out.get(1).getUuid());
        assertEquals("", out.get(2).getUuid());
    }

    @Test
    void queryDelegatesToEvaluator() throws Exception {
        NodesSelector byQuery = NodesSelector.newBuilder().query(Query.allOf("path^=docs/", "path*=1")).build();
        List<Node> out = nodesOf(resolver.resolve(byQuery, null, ActionMessage.empty()), ActionMessage.empty());
        assertEquals(List.of("docs/file10", "docs/file12", "docs/file14", "docs/file16", "docs/file18"),
                out.stream().map(Node::getPath).collect(Collectors.toList()));
    }

    @Test
    void filterAppliesToEventEntitiesWithoutScanningCatalog() throws Exception {
        ActionMessage event = ActionMessage.empty().withNodes(ImmutableList.of(
                Node.ofPath("docs/new.txt"), Node.ofPath("media/new.mp4"), Node.ofPath("docs/other.txt")));
        NodesSelector filter = NodesSelector.newBuilder().query(Query.of("path^=docs/")).build();
        List<Node> out = nodesOf(resolver.resolve(null, filter, event), event);
        assertEquals(List.of("docs/new.txt", "docs/other.txt"), out.stream().map(Node::getPath).collect(Collectors.toList()));
    }

    @Test
    void queryWithFilterMatchesEventEntitiesInsteadOfCatalog() throws Exception {
        ActionMessage event = ActionMessage.empty().withNodes(ImmutableList.of(
                Node.ofPath("docs/file0"), Node.ofPath("docs/draft.txt"), Node.ofPath("media/file1")));
        NodesSelector byQuery = NodesSelector.newBuilder().query(Query.of("path^=docs/")).build();
        NodesSelector filter = NodesSelector.newBuilder().query(Query.of("path*=file")).build();
        List<Node> out = nodesOf(resolver.resolve(byQuery, filter, event), event);
        assertEquals(List.of("docs/file0"), out.stream().map(Node::getPath).collect(Collectors.toList()));
    }

    @Test
    void presetFilterKeepsMatchingUsers() throws Exception {
        ActionMessage event = ActionMessage.empty().withUsers(List.of(new User("u1", "alice"), new User("u9", "mallory")));
        UsersSelector filter = UsersSelector.newBuilder().users(new User("", "alice")).collect(true).build();
        Targets targets = resolver.resolve(null, filter, event);
        List<ActionMessage> messages = Lists.newArrayList(targets.invocations(event));
        assertEquals(1, messages.size());
        assertEquals(List.of(new User("u1", "alice")), messages.get(0).getUsers());
    }

    @Test
    void selectorThenFilter() throws Exception {
        UsersSelector all = UsersSelector.newBuilder().all(true).build();
        UsersSelector filter = UsersSelector.newBuilder().query(Query.of("login=bob", "login=carol")).build();
        Targets targets = resolver.resolve(all, filter, ActionMessage.empty());
        List<String> logins = Lists.newArrayList(targets.invocations(ActionMessage.empty())).stream()
                .map(m -> m.getUsers().get(0).getLogin()).collect(Collectors.toList());
        assertEquals(List.of("bob", "carol"), logins);
    }

    @Test
    void noSelectorPassesInboundThrough() throws Exception {
        ActionMessage inbound = ActionMessage.ofEvent("evt");
        Targets targets = resolver.resolve(null, null, inbound);
        assertEquals(Targets.Mode.PASS_THROUGH, targets.getMode());
        assertEquals(List.of(inbound), Lists.newArrayList(targets.invocations(inbound)));
    }

    @Test
    void zeroMatchYieldsNoInvocation() throws Exception {
        NodesSelector none = NodesSelector.newBuilder().query(Query.of("path=nope")).build();
        assertFalse(resolver.resolve(none, null, ActionMessage.empty()).invocations(ActionMessage.empty()).hasNext());
        NodesSelector collected = NodesSelector.newBuilder().query(Query.of("path=nope")).collect(true).build();
        assertFalse(resolver.resolve(collected, null, ActionMessage.empty()).invocations(ActionMessage.empty()).hasNext());
    }

    @Test
    void sourceFilterMatchesInboundMessage() throws Exception {
        ActionMessage ok = ActionMessage.empty().withOutput(ActionOutput.success("done"));
        ActionMessage failed = ActionMessage.empty().withOutput(ActionOutput.failure("boom"));
        SourceFilter onSuccess = new SourceFilter(Query.of("last.success=true"));
        assertTrue(resolver.accepts(onSuccess, ok));
        assertFalse(resolver.accepts(onSuccess, failed));
        assertTrue(resolver.accepts(null, failed));
    }

    @Test
    void misconfiguredSelectorsAreRejected() {
        SelectorResolver bare = SelectorResolver.newBuilder().build();
        assertThrows(ConfigurationException.class,
                () -> bare.resolve(NodesSelector.newBuilder().all(true).build(), null, ActionMessage.empty()));
        assertThrows(ConfigurationException.class,
                () -> bare.resolve(NodesSelector.newBuilder().query(Query.of("path=a")).build(), null, ActionMessage.empty()));
        assertThrows(ConfigurationException.class,
                () -> resolver.resolve(NodesSelector.newBuilder().all(true).build(), UsersSelector.newBuilder().all(true).build(), ActionMessage.empty()));
        assertThrows(ConfigurationException.class,
                () -> resolver.resolve(NodesSelector.newBuilder().query(Query.of("no operator")).build(), null, ActionMessage.empty()));
        assertThrows(ConfigurationException.class,
                () -> resolver.resolve(NodesSelector.newBuilder().nodes(List.of(Node.newBuilder().build())).build(), null, ActionMessage.empty()));
    }
}
