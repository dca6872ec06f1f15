package com.soarsentinel.core.playbook;

import com.soarsentinel.core.predicate.FieldPaths;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders {@code {{ path }}} placeholders in step inputs against the
 * execution namespace.
 *
 * <ul>
 * <li>A string consisting of exactly one placeholder resolves to the raw
 * value, so numbers, lists and maps keep their type.</li>
 * <li>Otherwise each placeholder is replaced by the value's text.</li>
 * <li>Unresolved placeholders render as an empty string (or {@code null}
 * when they stand alone).</li>
 * </ul>
 *
 * <p>
 * Maps and lists are rendered recursively; other values pass through.
 * </p>
 */
public final class TemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.\\-]+)\\s*}}");

    public Map<String, Object> render(Map<String, Object> inputs, Map<String, ?> namespace) {
        Map<String, Object> rendered = new LinkedHashMap<>();
        if (inputs != null) {
            inputs.forEach((key, value) -> rendered.put(key, renderValue(value, namespace)));
        }
        return rendered;
    }

    Object renderValue(Object value, Map<String, ?> namespace) {
        if (value instanceof String s) {
            return renderString(s, namespace);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            map.forEach((k, v) -> out.put(String.valueOf(k), renderValue(v, namespace)));
            return out;
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object element : list) {
                out.add(renderValue(element, namespace));
            }
            return out;
        }
        return value;
    }

    private Object renderString(String template, Map<String, ?> namespace) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        if (matcher.matches()) {
            Object value = resolve(matcher.group(1), namespace);
            return value == FieldPaths.MISSING ? null : value;
        }
        matcher.reset();
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            Object value = resolve(matcher.group(1), namespace);
            String text = value == FieldPaths.MISSING || value == null ? "" : String.valueOf(value);
            matcher.appendReplacement(sb, Matcher.quoteReplacement(text));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    private static Object resolve(String path, Map<String, ?> namespace) {
        try {
            return FieldPaths.lookup(namespace, path);
        } catch (IllegalArgumentException e) {
            return FieldPaths.MISSING;
        }
    }
}
