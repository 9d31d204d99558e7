package org.commissaire.http.rest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One registered route. Immutable.
 *
 * The template is a literal path with {@code {name}} placeholders, one per path
 * segment variable. Each placeholder is constrained by a regular expression,
 * {@code [^/]+} unless the route supplies its own.
 */
public final class RouteDefinition {

    public static final String DEFAULT_SEGMENT_CONSTRAINT = "[^/]+";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final String template;
    private final Set<String> methods;
    private final Map<String, String> segmentConstraints;
    private final HandlerRef handlerRef;
    private final String action;

    private final Pattern pattern;
    private final List<String> segmentNames;
    private final List<Integer> segmentGroups;

    public RouteDefinition(String template,
                           Set<String> methods,
                           Map<String, String> segmentConstraints,
                           HandlerRef handlerRef,
                           String action) {
        if (template == null || template.isEmpty()) {
            throw new IllegalArgumentException("Route pattern must not be empty");
        }
        if (handlerRef == null) {
            throw new IllegalArgumentException("Route " + template + " has no handler");
        }
        this.template = template;
        this.handlerRef = handlerRef;
        this.action = action;

        Set<String> normalized = new LinkedHashSet<>();
        if (methods != null) {
            for (String method : methods) {
                normalized.add(method.toUpperCase(Locale.ROOT));
            }
        }
        this.methods = Collections.unmodifiableSet(normalized);

        Map<String, String> requested = segmentConstraints == null ? Map.of() : segmentConstraints;
        List<String> names = new ArrayList<>();
        List<Integer> groups = new ArrayList<>();
        Map<String, String> constraints = new LinkedHashMap<>();
        StringBuilder regex = new StringBuilder("^");

        // /api/v0/cluster/{name}/hosts/ -> ^\Q/api/v0/cluster/\E(<constraint>)\Q/hosts/\E$
        Matcher m = PLACEHOLDER.matcher(template);
        int literalStart = 0;
        int nextGroup = 1;
        while (m.find()) {
            String segment = m.group(1);
            if (constraints.containsKey(segment)) {
                throw new IllegalArgumentException("Route " + template + " names segment \"" + segment + "\" twice");
            }
            String constraint = requested.getOrDefault(segment, DEFAULT_SEGMENT_CONSTRAINT);
            int innerGroups = Pattern.compile(constraint).matcher("").groupCount();

            appendLiteral(regex, template.substring(literalStart, m.start()));
            regex.append('(').append(constraint).append(')');
            names.add(segment);
            groups.add(nextGroup);
            constraints.put(segment, constraint);
            nextGroup += 1 + innerGroups;
            literalStart = m.end();
        }
        appendLiteral(regex, template.substring(literalStart));
        regex.append('$');

        for (String segment : requested.keySet()) {
            if (!constraints.containsKey(segment)) {
                throw new IllegalArgumentException("Route " + template + " constrains unknown segment \"" + segment + "\"");
            }
        }

        this.pattern = Pattern.compile(regex.toString());
        this.segmentNames = Collections.unmodifiableList(names);
        this.segmentGroups = Collections.unmodifiableList(groups);
        this.segmentConstraints = Collections.unmodifiableMap(constraints);
    }

    private static void appendLiteral(StringBuilder regex, String literal) {
        if (!literal.isEmpty()) {
            regex.append(Pattern.quote(literal));
        }
    }

    /**
     * Binds this route's segments from {@code path}. Empty when the path does not
     * decompose against the template with every constraint satisfied.
     */
    Optional<Map<String, String>> bind(String path) {
        if (path == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(path);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < segmentNames.size(); i++) {
            String raw = matcher.group(segmentGroups.get(i));
            values.put(segmentNames.get(i), UrlCodec.decodePathSegment(raw));
        }
        return Optional.of(values);
    }

    boolean acceptsMethod(String method) {
        return methods.isEmpty() || (method != null && methods.contains(method.toUpperCase(Locale.ROOT)));
    }

    public String getTemplate() {
        return template;
    }

    public Set<String> getMethods() {
        return methods;
    }

    public Map<String, String> getSegmentConstraints() {
        return segmentConstraints;
    }

    public List<String> getSegmentNames() {
        return segmentNames;
    }

    public HandlerRef getHandlerRef() {
        return handlerRef;
    }

    public String getAction() {
        return action;
    }

    @Override
    public String toString() {
        return (methods.isEmpty() ? "*" : String.join("|", methods)) + " " + template + " -> " + handlerRef
                + (action == null ? "" : " [" + action + "]");
    }
}
