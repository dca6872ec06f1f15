package com.soarsentinel.core.predicate;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Dot-path lookup into nested maps and lists, shared by predicates and
 * playbook input templates.
 *
 * <p>
 * A path such as {@code steps.enrich.output.hosts.0} walks map keys and,
 * for list values, numeric indices. Lookup distinguishes an absent field
 * ({@link #MISSING}) from a field that is present with a {@code null} value.
 * </p>
 *
 * @since 1.0.0
 */
public final class FieldPaths {

    /** Sentinel returned when a path does not resolve. */
    public static final Object MISSING = new Object() {
        @Override
        public String toString() {
            return "<missing>";
        }
    };

    private FieldPaths() {
        // utility class, not instantiable
    }

    /**
     * @param path dot-separated path; must not be {@code null}
     * @return the path segments
     * @throws IllegalArgumentException if a segment is empty
     */
    public static List<String> split(String path) {
        Objects.requireNonNull(path, "path must not be null");
        List<String> segments = Arrays.asList(path.trim().split("\\.", -1));
        for (String segment : segments) {
            if (segment.isBlank()) {
                throw new IllegalArgumentException("Empty segment in field path: '" + path + "'");
            }
        }
        return segments;
    }

    /**
     * Resolve a path against a root map.
     *
     * @param root     root namespace
     * @param segments path segments
     * @return the value (possibly {@code null}) or {@link #MISSING}
     */
    public static Object lookup(Map<String, ?> root, List<String> segments) {
        Object current = root;
        for (String segment : segments) {
            if (current instanceof Map<?, ?> map) {
                if (!map.containsKey(segment)) {
                    return MISSING;
                }
                current = map.get(segment);
            } else if (current instanceof List<?> list) {
                int index = parseIndex(segment);
                if (index < 0 || index >= list.size()) {
                    return MISSING;
                }
                current = list.get(index);
            } else {
                return MISSING;
            }
        }
        return current;
    }

    /**
     * Convenience overload taking the dotted path.
     */
    public static Object lookup(Map<String, ?> root, String path) {
        return lookup(root, split(path));
    }

    private static int parseIndex(String segment) {
        try {
            return Integer.parseInt(segment);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
