package com.github.dimitryivaniuta.governance.ratelimit;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.core.GovernanceConfigurationException;
import com.github.dimitryivaniuta.governance.core.Role;
import com.github.dimitryivaniuta.governance.route.RouteClassRegistry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable quota policy table.
 *
 * Rules are keyed by an optional route class and an optional role. Lookup prefers
 * (routeClass, role), then (routeClass, any role), then (any route class, role).
 * No match means the request is not quota-limited.
 */
public final class QuotaTable {

    private final Map<Key, List<QuotaLimit>> rules;

    private QuotaTable(Map<Key, List<QuotaLimit>> rules) {
        this.rules = Collections.unmodifiableMap(rules);
    }

    public static QuotaTable from(List<GovernanceProperties.QuotaDef> defs, RouteClassRegistry registry) {
        Map<Key, List<QuotaLimit>> rules = new HashMap<>();
        for (GovernanceProperties.QuotaDef def : defs) {
            String rc = (def.getRouteClass() == null || def.getRouteClass().isBlank())
                    ? null
                    : registry.require(def.getRouteClass(), "Quota").name();
            if (rc == null && def.getRole() == null) {
                throw new GovernanceConfigurationException("Quota rule needs a route class, a role, or both");
            }

            List<QuotaLimit> limits = new ArrayList<>();
            for (GovernanceProperties.LimitDef l : def.getLimits()) {
                try {
                    limits.add(new QuotaLimit(l.getMax(), l.getWindow()));
                } catch (IllegalArgumentException ex) {
                    throw new GovernanceConfigurationException("Invalid quota limit for " + describe(rc, def.getRole()) + ": " + ex.getMessage());
                }
            }
            if (limits.isEmpty()) {
                throw new GovernanceConfigurationException("Quota rule " + describe(rc, def.getRole()) + " has no limits");
            }

            if (rules.putIfAbsent(new Key(rc, def.getRole()), List.copyOf(limits)) != null) {
                throw new GovernanceConfigurationException("Quota rule " + describe(rc, def.getRole()) + " declared twice");
            }
        }
        return new QuotaTable(rules);
    }

    /** Limits that apply to the call; an empty list means unlimited. */
    public List<QuotaLimit> limitsFor(String routeClass, Role role) {
        List<QuotaLimit> l = rules.get(new Key(routeClass, role));
        if (l == null) l = rules.get(new Key(routeClass, null));
        if (l == null) l = rules.get(new Key(null, role));
        return (l == null) ? List.of() : l;
    }

    private static String describe(String routeClass, Role role) {
        return "[" + (routeClass == null ? "*" : routeClass) + ", " + (role == null ? "*" : role) + "]";
    }

    private record Key(String routeClass, Role role) {}
}
