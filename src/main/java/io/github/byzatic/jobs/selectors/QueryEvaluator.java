package io.github.byzatic.jobs.selectors;

import io.github.byzatic.jobs.base_exceptions.ConfigurationException;
import io.github.byzatic.jobs.model.Query;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.function.Predicate;

/**
 * Evaluates the opaque {@link Query} language. The engine only relies on this contract.
 *
 * @param <T> entity type the queries apply to
 */
public interface QueryEvaluator<T> {

    /**
     * Turns a query into a predicate usable on entities carried by a message.
     *
     * @throws ConfigurationException when the query is malformed
     */
    @NotNull Predicate<T> compile(@NotNull Query query) throws ConfigurationException;

    /**
     * Every catalog entity matching the query, in evaluator order. The iterator may be lazy and is
     * consumed once.
     *
     * @throws ConfigurationException when the query is malformed or the evaluator has no catalog
     */
    @NotNull Iterator<T> select(@NotNull Query query) throws ConfigurationException;
}
