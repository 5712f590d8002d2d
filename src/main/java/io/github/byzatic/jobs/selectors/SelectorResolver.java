package io.github.byzatic.jobs.selectors;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import io.github.byzatic.jobs.catalog.EntityCatalog;
import io.github.byzatic.jobs.catalog.PagedIterator;
import io.github.byzatic.jobs.config.JobsConfig;
import io.github.byzatic.jobs.model.ActionMessage;
import io.github.byzatic.jobs.model.Node;
import io.github.byzatic.jobs.model.Query;
import io.github.byzatic.jobs.model.User;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Turns the selectors of an action into the entities it applies to.
 * <p>
 * A selector picks, in order of precedence, the whole catalog ({@code all}), its preset or the matches
 * of its query. A filter restricts either the selector's sequence or, without a selector, the entities
 * carried by the inbound message. A query selector paired with a filter matches its query against the
 * inbound entities instead of scanning the catalog. With neither, the inbound message passes through
 * unchanged.
 */
@ThreadSafe
public final class SelectorResolver {
    private final static Logger logger = LoggerFactory.getLogger(SelectorResolver.class);

    private final EntityCatalog<Node> nodeCatalog;
    private final EntityCatalog<User> userCatalog;
    private final QueryEvaluator<Node> nodeEvaluator;
    private final QueryEvaluator<User> userEvaluator;
    private final QueryEvaluator<ActionMessage> messageEvaluator;
    private final int pageSize;

    private SelectorResolver(Builder builder) {
        this.nodeCatalog = builder.nodeCatalog;
        this.userCatalog = builder.userCatalog;
        this.nodeEvaluator = builder.nodeEvaluator;
        this.userEvaluator = builder.userEvaluator;
        this.messageEvaluator = builder.messageEvaluator;
        this.pageSize = builder.pageSize;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * @param selector selector of the action, may be null
     * @param filter   filter of the action, may be null, must target the same entities as the selector
     * @param context  inbound message of the action
     * @throws ConfigurationException on a malformed selector or a query nobody can evaluate
     */
    public @NotNull Targets resolve(@Nullable Selector selector, @Nullable Selector filter, @NotNull ActionMessage context) throws ConfigurationException {
        if (selector == null && filter == null) return Targets.passThrough();
        if (selector != null && selector.kind() == Selector.Kind.SOURCE) {
            throw new ConfigurationException("A source filter can't select entities");
        }
        if (filter != null && filter.kind() == Selector.Kind.SOURCE) {
            throw new ConfigurationException("A source filter can't filter entities");
        }
        if (selector != null && filter != null && selector.kind() != filter.kind()) {
            throw new ConfigurationException("Selector " + selector.kind() + " and filter " + filter.kind() + " target different entities");
        }
        Selector.Kind kind = selector != null ? selector.kind() : filter.kind();
        boolean collect = selector != null ? selector.isCollect() : filter.isCollect();
        if (kind == Selector.Kind.NODES) {
            Iterable<Node> nodes;
            if (selector == null) {
                nodes = context.getNodes();
            } else if (filter != null && isQueryOnly((NodesSelector) selector)) {
                nodes = matchNodes(context.getNodes(), ((NodesSelector) selector).getQuery());
            } else {
                nodes = selectNodes((NodesSelector) selector);
            }
            if (filter != null) nodes = filterNodes(nodes, (NodesSelector) filter);
            logger.trace("Resolved {} (filter {}) to nodes", selector, filter);
            return Targets.ofNodes(nodes, collect);
        }
        Iterable<User> users;
        if (selector == null) {
            users = context.getUsers();
        } else if (filter != null && isQueryOnly((UsersSelector) selector)) {
            users = matchUsers(context.getUsers(), ((UsersSelector) selector).getQuery());
        } else {
            users = selectUsers((UsersSelector) selector);
        }
        if (filter != null) users = filterUsers(users, (UsersSelector) filter);
        logger.trace("Resolved {} (filter {}) to users", selector, filter);
        return Targets.ofUsers(users, collect);
    }

    /**
     * Whether the inbound message passes the source filter. A null filter accepts everything.
     */
    public boolean accepts(@Nullable SourceFilter sourceFilter, @NotNull ActionMessage message) throws ConfigurationException {
        if (sourceFilter == null || sourceFilter.getQuery() == null) return true;
        if (messageEvaluator == null) throw new ConfigurationException("No evaluator for source filter " + sourceFilter);
        return messageEvaluator.compile(sourceFilter.getQuery()).test(message);
    }

    private Iterable<Node> selectNodes(NodesSelector selector) throws ConfigurationException {
        if (selector.isAll()) {
            if (nodeCatalog == null) throw new ConfigurationException("No node catalog to select all nodes from");
            return () -> new PagedIterator<>(nodeCatalog, pageSize);
        }
        if (selector.hasPreset()) {
            ImmutableList.Builder<Node> preset = ImmutableList.builder();
            for (Node node : selector.getNodes()) {
                if (node.getPath().isEmpty() && node.getUuid().isEmpty()) {
                    throw new ConfigurationException("Preset node without path or uuid in " + selector);
                }
                preset.add(node);
            }
            for (String path : selector.getPaths()) preset.add(lookupNode(path));
            return preset.build();
        }
        if (selector.hasQuery()) {
            if (nodeEvaluator == null) throw new ConfigurationException("No evaluator for node query " + selector.getQuery());
            return oneShot(nodeEvaluator.select(selector.getQuery()));
        }
        return List.of();
    }

    private static boolean isQueryOnly(NodesSelector selector) {
        return !selector.isAll() && !selector.hasPreset() && selector.hasQuery();
    }

    private static boolean isQueryOnly(UsersSelector selector) {
        return !selector.isAll() && !selector.hasPreset() && selector.hasQuery();
    }

    private Iterable<Node> matchNodes(Iterable<Node> nodes, Query query) throws ConfigurationException {
        if (nodeEvaluator == null) throw new ConfigurationException("No evaluator for node query " + query);
        Predicate<Node> predicate = nodeEvaluator.compile(query);
        return Iterables.filter(nodes, predicate::test);
    }

    private Iterable<User> matchUsers(Iterable<User> users, Query query) throws ConfigurationException {
        if (userEvaluator == null) throw new ConfigurationException("No evaluator for user query " + query);
        Predicate<User> predicate = userEvaluator.compile(query);
        return Iterables.filter(users, predicate::test);
    }

    private Node lookupNode(String path) {
        if (nodeCatalog != null) {
            try {
                Optional<Node> found = nodeCatalog.lookup(path);
                if (found.isPresent()) return found.get();
            } catch (IOException e) {
                logger.warn("Can't look up node {}, using the bare path", path, e);
            }
        }
        return Node.ofPath(path);
    }

    private Iterable<Node> filterNodes(Iterable<Node> nodes, NodesSelector filter) throws ConfigurationException {
        if (filter.isAll()) return nodes;
        if (filter.hasPreset()) {
            Set<String> keys = new HashSet<>(filter.getPaths());
            for (Node node : filter.getNodes()) {
                if (!node.getPath().isEmpty()) keys.add(node.getPath());
                if (!node.getUuid().isEmpty()) keys.add(node.getUuid());
            }
            return Iterables.filter(nodes, node -> keys.contains(node.getPath()) || keys.contains(node.getUuid()));
        }
        if (filter.hasQuery()) {
            if (nodeEvaluator == null) throw new ConfigurationException("No evaluator for node filter " + filter.getQuery());
            Predicate<Node> predicate = nodeEvaluator.compile(filter.getQuery());
            return Iterables.filter(nodes, predicate::test);
        }
        return nodes;
    }

    private Iterable<User> selectUsers(UsersSelector selector) throws ConfigurationException {
        if (selector.isAll()) {
            if (userCatalog == null) throw new ConfigurationException("No user catalog to select all users from");
            return () -> new PagedIterator<>(userCatalog, pageSize);
        }
        if (selector.hasPreset()) {
            for (User user : selector.getUsers()) {
                if (user.getLogin().isEmpty() && user.getUuid().isEmpty()) {
                    throw new ConfigurationException("Preset user without login or uuid in " + selector);
                }
            }
            return selector.getUsers();
        }
        if (selector.hasQuery()) {
            if (userEvaluator == null) throw new ConfigurationException("No evaluator for user query " + selector.getQuery());
            return oneShot(userEvaluator.select(selector.getQuery()));
        }
        return List.of();
    }

    private Iterable<User> filterUsers(Iterable<User> users, UsersSelector filter) throws ConfigurationException {
        if (filter.isAll()) return users;
        if (filter.hasPreset()) {
            Set<String> keys = new HashSet<>();
            for (User user : filter.getUsers()) {
                if (!user.getLogin().isEmpty()) keys.add(user.getLogin());
                if (!user.getUuid().isEmpty()) keys.add(user.getUuid());
            }
            return Iterables.filter(users, user -> keys.contains(user.getLogin()) || keys.contains(user.getUuid()));
        }
        if (filter.hasQuery()) {
            if (userEvaluator == null) throw new ConfigurationException("No evaluator for user filter " + filter.getQuery());
            Predicate<User> predicate = userEvaluator.compile(filter.getQuery());
            return Iterables.filter(users, predicate::test);
        }
        return users;
    }

    private static <T> Iterable<T> oneShot(Iterator<T> iterator) {
        return () -> iterator;
    }

    public static final class Builder {
        private EntityCatalog<Node> nodeCatalog;
        private EntityCatalog<User> userCatalog;
        private QueryEvaluator<Node> nodeEvaluator;
        private QueryEvaluator<User> userEvaluator;
        private QueryEvaluator<ActionMessage> messageEvaluator = FieldQueryEvaluator.forMessages();
        private int pageSize = JobsConfig.DEFAULT_CATALOG_PAGE_SIZE;

        public Builder nodeCatalog(EntityCatalog<Node> nodeCatalog) {
            this.nodeCatalog = nodeCatalog;
            return this;
        }

        public Builder userCatalog(EntityCatalog<User> userCatalog) {
            this.userCatalog = userCatalog;
            return this;
        }

        public Builder nodeEvaluator(QueryEvaluator<Node> nodeEvaluator) {
            this.nodeEvaluator = nodeEvaluator;
            return this;
        }

        public Builder userEvaluator(QueryEvaluator<User> userEvaluator) {
            this.userEvaluator = userEvaluator;
            return this;
        }

        public Builder messageEvaluator(QueryEvaluator<ActionMessage> messageEvaluator) {
            this.messageEvaluator = messageEvaluator;
            return this;
        }

        public Builder pageSize(int pageSize) {
            if (pageSize <= 0) throw new IllegalArgumentException("pageSize must be > 0");
            this.pageSize = pageSize;
            return this;
        }

        /**
         * Field evaluators over the catalogs are installed where none was given.
         */
        public SelectorResolver build() {
            if (nodeEvaluator == null && nodeCatalog != null) nodeEvaluator = FieldQueryEvaluator.forNodes(nodeCatalog, pageSize);
            if (userEvaluator == null && userCatalog != null) userEvaluator = FieldQueryEvaluator.forUsers(userCatalog, pageSize);
            return new SelectorResolver(this);
        }
    }
}
