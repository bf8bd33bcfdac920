package com.github.dimitryivaniuta.governance.route;

import com.github.dimitryivaniuta.governance.core.RouteClass;
import org.springframework.web.util.pattern.PathPattern;

import java.util.Set;

/**
 * Endpoint (path pattern + methods) attached to exactly one route class.
 * An empty method set matches every method.
 */
public record RouteBinding(PathPattern pattern, Set<String> methods, RouteClass routeClass) {

    public boolean matchesMethod(String method) {
        return methods.isEmpty() || methods.contains(method);
    }
}
