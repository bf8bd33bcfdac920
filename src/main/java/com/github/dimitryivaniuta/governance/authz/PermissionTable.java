package com.github.dimitryivaniuta.governance.authz;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.core.GovernanceConfigurationException;
import com.github.dimitryivaniuta.governance.core.Role;
import com.github.dimitryivaniuta.governance.core.RouteClass;
import com.github.dimitryivaniuta.governance.route.RouteClassRegistry;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable (role, route class) -> allowed methods table.
 * A pair that is not present is denied. An empty method set allows every method.
 */
public final class PermissionTable {

    private final Map<Key, Set<String>> rules;

    private PermissionTable(Map<Key, Set<String>> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public static PermissionTable from(List<GovernanceProperties.PermissionDef> defs, RouteClassRegistry registry) {
        Map<Key, Set<String>> rules = new HashMap<>();
        for (GovernanceProperties.PermissionDef def : defs) {
            Role role = def.getRole();
            Set<String> methods = Collections.unmodifiableSet(normalize(def.getMethods()));

            for (String name : def.getRouteClasses()) {
                RouteClass rc = registry.require(name, "Permission for " + role);
                if (role.isAnonymous() && !rc.isPublic()) {
                    throw new GovernanceConfigurationException(
                            "ANONYMOUS may only be granted public route classes, got '" + rc.name() + "'");
                }
                if (rules.putIfAbsent(new Key(role, rc.name()), methods) != null) {
                    throw new GovernanceConfigurationException(
                            "Permission for " + role + " on '" + rc.name() + "' declared twice");
                }
            }
        }
        return new PermissionTable(rules);
    }

    /** Allowed methods for the pair, or null when the pair is absent. */
    Set<String> lookup(Role role, String routeClass) {
        return rules.get(new Key(role, routeClass));
    }

    public int size() {
        return rules.size();
    }

    private static Set<String> normalize(List<String> methods) {
        Set<String> out = new LinkedHashSet<>();
        if (methods == null) return out;
        for (String m : methods) {
            if (m == null || m.isBlank()) continue;
            String v = m.trim().toUpperCase(Locale.ROOT);
            if ("*".equals(v)) return new LinkedHashSet<>();
            out.add(v);
        }
        return out;
    }

    private record Key(Role role, String routeClass) {}
}
