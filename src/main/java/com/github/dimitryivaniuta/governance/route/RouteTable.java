package com.github.dimitryivaniuta.governance.route;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.core.GovernanceConfigurationException;
import com.github.dimitryivaniuta.governance.core.RouteClass;
import org.springframework.http.server.PathContainer;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;
import org.springframework.web.util.pattern.PatternParseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static mapping of endpoints to route classes.
 *
 * Loading fails if two bindings claim the same method on an equivalent pattern
 * (patterns that differ only in path variable names are equivalent), or if two
 * overlapping patterns of equal specificity, such as {@code /a/{x}/b} and
 * {@code /a/b/{y}}, bind a shared method to different route classes. When several
 * wildcard patterns match one request the most specific pattern wins.
 */
public final class RouteTable {

    private static final String ANY_METHOD = "*";
    private static final Pattern PATH_VARIABLE = Pattern.compile("\\{[^}/]+}");
    private static final Pattern WHOLE_SEGMENT_VARIABLE = Pattern.compile("\\{[^}/*:]+}");

    private final List<RouteBinding> bindings;

    private RouteTable(List<RouteBinding> bindings) {
        this.bindings = List.copyOf(bindings);
    }

    public static RouteTable from(List<GovernanceProperties.RouteDef> defs, RouteClassRegistry registry) {
        PathPatternParser parser = new PathPatternParser();
        List<RouteBinding> out = new ArrayList<>();
        // shape -> (method -> route class name)
        Map<String, Map<String, String>> claimed = new HashMap<>();

        for (GovernanceProperties.RouteDef def : defs) {
            String raw = def.getPattern().trim();
            RouteClass rc = registry.require(def.getRouteClass(), "Route '" + raw + "'");

            PathPattern pattern;
            try {
                pattern = parser.parse(raw);
            } catch (PatternParseException ex) {
                throw new GovernanceConfigurationException("Invalid route pattern '" + raw + "': " + ex.getMessage());
            }

            Set<String> methods = normalizeMethods(def.getMethods());
            String shape = PATH_VARIABLE.matcher(raw).replaceAll("{}");
            Map<String, String> sameShape = claimed.computeIfAbsent(shape, k -> new HashMap<>());
            for (String m : methods.isEmpty() ? Set.of(ANY_METHOD) : methods) {
                String previous = conflicting(sameShape, m);
                if (previous != null) {
                    throw new GovernanceConfigurationException(
                            "Endpoint " + m + " " + raw + " is bound to both '" + previous + "' and '" + rc.name() + "'");
                }
                sameShape.put(m, rc.name());
            }
            RouteBinding binding = new RouteBinding(pattern, methods, rc);
            for (RouteBinding other : out) {
                if (ambiguous(binding, other)) {
                    throw new GovernanceConfigurationException("Routes " + other.pattern().getPatternString()
                            + " ('" + other.routeClass().name() + "') and " + raw + " ('" + rc.name()
                            + "') overlap with equal specificity");
                }
            }
            out.add(binding);
        }
        return new RouteTable(out);
    }

    /**
     * Route class of the endpoint serving {@code method path}, or empty when no binding matches.
     */
    public Optional<RouteClass> resolve(String method, String path) {
        String m = method == null ? "" : method.toUpperCase(Locale.ROOT);
        PathContainer container = PathContainer.parsePath(stripTrailingSlash(path));

        RouteBinding best = null;
        for (RouteBinding b : bindings) {
            if (!b.matchesMethod(m) || !b.pattern().matches(container)) continue;
            if (best == null || PathPattern.SPECIFICITY_COMPARATOR.compare(b.pattern(), best.pattern()) < 0) {
                best = b;
            }
        }
        return Optional.ofNullable(best).map(RouteBinding::routeClass);
    }

    public List<RouteBinding> bindings() {
        return bindings;
    }

    // "/api/v1/events/" and "/api/v1/events" are the same endpoint
    private static String stripTrailingSlash(String path) {
        if (path == null || path.isEmpty()) return "/";
        return (path.length() > 1 && path.endsWith("/")) ? path.substring(0, path.length() - 1) : path;
    }

    // an "any method" binding collides with every explicit method on the same shape
    private static String conflicting(Map<String, String> sameShape, String method) {
        if (ANY_METHOD.equals(method)) {
            return sameShape.values().stream().findFirst().orElse(null);
        }
        String exact = sameShape.get(method);
        return (exact != null) ? exact : sameShape.get(ANY_METHOD);
    }

    /**
     * True when both bindings can serve the same request, neither pattern is more specific,
     * and they disagree on the route class. Only patterns made of literal and whole-segment
     * variable or {@code *} segments are compared; others fall back to specificity ordering.
     */
    private static boolean ambiguous(RouteBinding a, RouteBinding b) {
        if (a.routeClass().name().equals(b.routeClass().name())) return false;
        if (!sharesMethod(a.methods(), b.methods())) return false;
        if (PathPattern.SPECIFICITY_COMPARATOR.compare(a.pattern(), b.pattern()) != 0) return false;

        String[] sa = a.pattern().getPatternString().split("/");
        String[] sb = b.pattern().getPatternString().split("/");
        if (sa.length != sb.length) return false;
        for (int i = 0; i < sa.length; i++) {
            boolean wildA = isWildSegment(sa[i]);
            boolean wildB = isWildSegment(sb[i]);
            if (!wildA && !isLiteralSegment(sa[i])) return false;
            if (!wildB && !isLiteralSegment(sb[i])) return false;
            if (!wildA && !wildB && !sa[i].equals(sb[i])) return false;
        }
        return true;
    }

    private static boolean sharesMethod(Set<String> a, Set<String> b) {
        if (a.isEmpty() || b.isEmpty()) return true;
        for (String m : a) {
            if (b.contains(m)) return true;
        }
        return false;
    }

    private static boolean isWildSegment(String segment) {
        return "*".equals(segment) || WHOLE_SEGMENT_VARIABLE.matcher(segment).matches();
    }

    private static boolean isLiteralSegment(String segment) {
        return segment.chars().noneMatch(c -> c == '{' || c == '}' || c == '*' || c == '?');
    }

    static Set<String> normalizeMethods(List<String> methods) {
        Set<String> out = new LinkedHashSet<>();
        if (methods == null) return out;
        for (String m : methods) {
            if (m == null || m.isBlank()) continue;
            String v = m.trim().toUpperCase(Locale.ROOT);
            if (ANY_METHOD.equals(v)) return new LinkedHashSet<>();
            out.add(v);
        }
        return out;
    }
}
