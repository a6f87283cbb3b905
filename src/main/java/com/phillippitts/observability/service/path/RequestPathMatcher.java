package com.phillippitts.observability.service.path;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Path exclusion and low-cardinality path normalization for metric labels.
 *
 * <p><b>Normalization:</b> a path is first matched against the configured route templates
 * (e.g. {@code /users/{id}}; a {@code {...}} segment matches any single segment). When no
 * template matches, every segment that looks like a dynamic identifier is replaced with
 * {@value #ID_PLACEHOLDER}:
 * <ul>
 *   <li>numeric ({@code 123})</li>
 *   <li>UUID ({@code 3f2b...-...})</li>
 *   <li>hexadecimal with at least one digit, 8+ characters ({@code 5f3a9c0e})</li>
 *   <li>opaque token of 16+ characters mixing letters and digits ({@code aZ9kq2LmX0pQ7rT1})</li>
 * </ul>
 *
 * <p>The number of distinct normalized paths is therefore bounded by the number of route
 * templates plus the number of distinct literal segment sequences the service exposes; it never
 * grows with the number of distinct identifiers requested.
 *
 * <p><b>Thread Safety:</b> immutable after construction.
 */
public class RequestPathMatcher {

    /** Replacement for a segment classified as a dynamic identifier. */
    public static final String ID_PLACEHOLDER = "{id}";

    private static final Pattern NUMERIC = Pattern.compile("\\d+");
    private static final Pattern UUID = Pattern.compile(
            "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final Pattern HEX = Pattern.compile("(?=.*\\d)[0-9a-fA-F]{8,}");
    private static final Pattern OPAQUE = Pattern.compile("(?=.*\\d)(?=.*[A-Za-z])[A-Za-z0-9_-]{16,}");

    private final List<String[]> templates;

    /**
     * Creates a matcher that only uses heuristic segment classification.
     */
    public RequestPathMatcher() {
        this(List.of());
    }

    /**
     * Creates a matcher that tries the given route templates before heuristic classification.
     *
     * @param routeTemplates templates such as {@code /users/{id}/orders/{orderId}}
     */
    public RequestPathMatcher(Collection<String> routeTemplates) {
        Objects.requireNonNull(routeTemplates, "routeTemplates");
        List<String[]> parsed = new ArrayList<>(routeTemplates.size());
        for (String template : routeTemplates) {
            if (template != null && !template.isBlank()) {
                parsed.add(segments(template.trim()));
            }
        }
        this.templates = List.copyOf(parsed);
    }

    /**
     * Checks whether a path is excluded from instrumentation.
     *
     * <p>A pattern matches when it equals the path, or when it contains {@code *} and the path
     * starts with the text preceding the first {@code *} ({@code /internal/*} matches
     * {@code /internal/jobs/7}).
     *
     * @param path request path
     * @param patterns exclusion patterns
     * @return {@code true} when any pattern matches
     */
    public static boolean isExcluded(String path, Collection<String> patterns) {
        if (path == null || patterns == null || patterns.isEmpty()) {
            return false;
        }
        for (String pattern : patterns) {
            if (pattern == null || pattern.isEmpty()) {
                continue;
            }
            int star = pattern.indexOf('*');
            if (star >= 0) {
                if (path.startsWith(pattern.substring(0, star))) {
                    return true;
                }
            } else if (path.equals(pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Collapses a concrete path into its route template.
     *
     * @param path concrete request path, may include a query string
     * @return template such as {@code /users/{id}}; {@code /} for null or empty paths
     */
    public String normalize(String path) {
        String[] segments = segments(stripQuery(path));
        if (segments.length == 0) {
            return "/";
        }
        for (String[] template : templates) {
            if (matches(template, segments)) {
                return join(template);
            }
        }
        String[] normalized = new String[segments.length];
        for (int i = 0; i < segments.length; i++) {
            normalized[i] = isIdentifier(segments[i]) ? ID_PLACEHOLDER : segments[i];
        }
        return join(normalized);
    }

    static boolean isIdentifier(String segment) {
        return NUMERIC.matcher(segment).matches()
                || UUID.matcher(segment).matches()
                || HEX.matcher(segment).matches()
                || OPAQUE.matcher(segment).matches();
    }

    private static boolean matches(String[] template, String[] segments) {
        if (template.length != segments.length) {
            return false;
        }
        for (int i = 0; i < template.length; i++) {
            if (!isVariable(template[i]) && !template[i].equals(segments[i])) {
                return false;
            }
        }
        return true;
    }

    private static boolean isVariable(String segment) {
        return segment.length() > 2 && segment.startsWith("{") && segment.endsWith("}");
    }

    private static String stripQuery(String path) {
        if (path == null) {
            return "";
        }
        int query = path.indexOf('?');
        return query >= 0 ? path.substring(0, query) : path;
    }

    private static String[] segments(String path) {
        List<String> parts = new ArrayList<>();
        for (String part : path.split("/")) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts.toArray(String[]::new);
    }

    private static String join(String[] segments) {
        if (segments.length == 0) {
            return "/";
        }
        return "/" + String.join("/", segments);
    }
}
