package com.soarsentinel.core.predicate;

import com.soarsentinel.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point of the predicate language.
 *
 * <h3>Safety</h3>
 * <p>
 * Predicates are parsed into a tree of a handful of node types and walked
 * once per evaluation. Nothing is compiled to bytecode or scripted, there are
 * no loops and the only function is {@code contains}, so evaluation time is
 * bounded by the predicate length.
 * </p>
 *
 * <h3>Caching</h3>
 * <p>
 * Compiled predicates are cached by source text. Bindings are few and their
 * predicates change rarely, so the cache is unbounded.
 * </p>
 *
 * @since 1.0.0
 */
public final class PredicateEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(PredicateEvaluator.class);

    private final Map<String, CompiledPredicate> cache = new ConcurrentHashMap<>();

    /**
     * Parse a predicate, reusing a cached result where possible.
     *
     * @throws PredicateSyntaxException if the predicate is malformed
     */
    public CompiledPredicate compile(String predicate) {
        Objects.requireNonNull(predicate, "predicate must not be null");
        String key = predicate.trim();
        CompiledPredicate cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        CompiledPredicate compiled = new CompiledPredicate(key, PredicateParser.parse(key));
        cache.putIfAbsent(key, compiled);
        return compiled;
    }

    /**
     * Check that a predicate parses. Used when bindings are authored.
     *
     * @throws PredicateSyntaxException if the predicate is malformed
     */
    public void validate(String predicate) {
        compile(predicate);
    }

    /**
     * Evaluate a predicate over an event's {@code data} fields.
     *
     * <p>
     * An absent field without a {@code ??} default is a non-match, not an
     * error. A {@code null} or blank predicate matches every event.
     * </p>
     *
     * @throws PredicateSyntaxException if the predicate is malformed
     */
    public boolean evaluate(String predicate, Event event) {
        Objects.requireNonNull(event, "event must not be null");
        return evaluate(predicate, event.getData());
    }

    /**
     * Evaluate a predicate over an arbitrary namespace, leniently.
     *
     * @throws PredicateSyntaxException if the predicate is malformed
     */
    public boolean evaluate(String predicate, Map<String, ?> root) {
        if (predicate == null || predicate.isBlank()) {
            return true;
        }
        CompiledPredicate compiled = compile(predicate);
        try {
            return compiled.test(root);
        } catch (PredicateEvaluationException e) {
            LOG.trace("Predicate [{}] treated as non-match: {}", predicate, e.getMessage());
            return false;
        }
    }

    int cacheSize() {
        return cache.size();
    }
}
