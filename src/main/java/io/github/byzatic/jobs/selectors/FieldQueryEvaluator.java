package io.github.byzatic.jobs.selectors;

import com.google.common.collect.Iterators;
import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import io.github.byzatic.jobs.catalog.EntityCatalog;
import io.github.byzatic.jobs.catalog.PagedIterator;
import io.github.byzatic.jobs.model.ActionMessage;
import io.github.byzatic.jobs.model.ActionOutput;
import io.github.byzatic.jobs.model.Node;
import io.github.byzatic.jobs.model.Query;
import io.github.byzatic.jobs.model.User;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Reference evaluator matching entity fields.
 * <p>
 * Each sub-query is {@code field=value} (equals), {@code field!=value} (differs),
 * {@code field^=value} (starts with) or {@code field*=value} (contains). Sub-queries are combined
 * with the query operation. A missing field never matches, except for {@code !=}.
 * <ul>
 *   <li>nodes: {@code path}, {@code uuid}, {@code type}, {@code size}, {@code mtime}, {@code meta.<key>}</li>
 *   <li>users: {@code uuid}, {@code login}, {@code group}, {@code attr.<key>}</li>
 *   <li>messages: {@code event}, {@code nodes}, {@code users}, {@code outputs}, {@code last.success},
 *   {@code last.ignored}, {@code last.body}, {@code last.error}</li>
 * </ul>
 */
public final class FieldQueryEvaluator<T> implements QueryEvaluator<T> {
    private final Function<T, Map<String, String>> fields;
    private final EntityCatalog<T> catalog;
    private final int pageSize;

    public FieldQueryEvaluator(@NotNull Function<T, Map<String, String>> fields, @Nullable EntityCatalog<T> catalog, int pageSize) {
        this.fields = Objects.requireNonNull(fields);
        this.catalog = catalog;
        this.pageSize = pageSize;
    }

    public static FieldQueryEvaluator<Node> forNodes(@Nullable EntityCatalog<Node> catalog, int pageSize) {
        return new FieldQueryEvaluator<>(FieldQueryEvaluator::nodeFields, catalog, pageSize);
    }

    public static FieldQueryEvaluator<User> forUsers(@Nullable EntityCatalog<User> catalog, int pageSize) {
        return new FieldQueryEvaluator<>(FieldQueryEvaluator::userFields, catalog, pageSize);
    }

    public static FieldQueryEvaluator<ActionMessage> forMessages() {
        return new FieldQueryEvaluator<>(FieldQueryEvaluator::messageFields, null, 1);
    }

    @Override
    public @NotNull Predicate<T> compile(@NotNull Query query) throws ConfigurationException {
        List<Predicate<Map<String, String>>> terms = new ArrayList<>();
        for (String sub : query.getSubQueries()) terms.add(parseTerm(sub));
        boolean and = query.getOperation() == Query.Operation.AND;
        return entity -> {
            if (terms.isEmpty()) return true;
            Map<String, String> values = fields.apply(entity);
            for (Predicate<Map<String, String>> term : terms) {
                boolean ok = term.test(values);
                if (and && !ok) return false;
                if (!and && ok) return true;
            }
            return and;
        };
    }

    @Override
    public @NotNull Iterator<T> select(@NotNull Query query) throws ConfigurationException {
        if (catalog == null) throw new ConfigurationException("No catalog to select from for " + query);
        Predicate<T> predicate = compile(query);
        Iterator<T> matching = Iterators.filter(new PagedIterator<>(catalog, pageSize), predicate::test);
        if (query.getOffset() > 0) Iterators.advance(matching, (int) Math.min(Integer.MAX_VALUE, query.getOffset()));
        if (query.getLimit() > 0) return Iterators.limit(matching, (int) Math.min(Integer.MAX_VALUE, query.getLimit()));
        return matching;
    }

    private static Predicate<Map<String, String>> parseTerm(String term) throws ConfigurationException {
        int eq = term.indexOf('=');
        if (eq <= 0) throw new ConfigurationException("Malformed sub-query, expected field<op>value: '" + term + "'");
        char op = term.charAt(eq - 1);
        boolean hasOp = op == '^' || op == '*' || op == '!';
        String field = term.substring(0, hasOp ? eq - 1 : eq).trim();
        String value = term.substring(eq + 1).trim();
        if (field.isEmpty()) throw new ConfigurationException("Malformed sub-query, empty field: '" + term + "'");
        if (!hasOp) return m -> value.equals(m.get(field));
        return switch (op) {
            case '^' -> m -> m.get(field) != null && m.get(field).startsWith(value);
            case '*' -> m -> m.get(field) != null && m.get(field).contains(value);
            default -> m -> !value.equals(m.get(field));
        };
    }

    private static Map<String, String> nodeFields(Node node) {
        Map<String, String> m = new HashMap<>();
        m.put("path", node.getPath());
        m.put("uuid", node.getUuid());
        m.put("type", node.getType().name());
        m.put("size", Long.toString(node.getSize()));
        m.put("mtime", Long.toString(node.getMtime()));
        node.getMetadata().forEach((k, v) -> m.put("meta." + k, v));
        return m;
    }

    private static Map<String, String> userFields(User user) {
        Map<String, String> m = new HashMap<>();
        m.put("uuid", user.getUuid());
        m.put("login", user.getLogin());
        m.put("group", user.getGroupPath());
        user.getAttributes().forEach((k, v) -> m.put("attr." + k, v));
        return m;
    }

    private static Map<String, String> messageFields(ActionMessage message) {
        Map<String, String> m = new HashMap<>();
        if (message.getEvent() != null) m.put("event", String.valueOf(message.getEvent()));
        m.put("nodes", Integer.toString(message.getNodes().size()));
        m.put("users", Integer.toString(message.getUsers().size()));
        m.put("outputs", Integer.toString(message.getOutputChain().size()));
        message.getLastOutput().ifPresent((ActionOutput last) -> {
            m.put("last.success", Boolean.toString(last.isSuccess()));
            m.put("last.ignored", Boolean.toString(last.isIgnored()));
            m.put("last.body", last.getStringBody());
            m.put("last.error", last.getErrorString());
        });
        return m;
    }
}
