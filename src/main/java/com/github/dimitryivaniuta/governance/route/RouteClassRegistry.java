package com.github.dimitryivaniuta.governance.route;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.core.GovernanceConfigurationException;
import com.github.dimitryivaniuta.governance.core.RouteClass;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of route classes declared at startup.
 */
public final class RouteClassRegistry {

    private final Map<String, RouteClass> byName;

    private RouteClassRegistry(Map<String, RouteClass> byName) {
        this.byName = Collections.unmodifiableMap(byName);
    }

    public static RouteClassRegistry of(Collection<RouteClass> classes) {
        Map<String, RouteClass> m = new LinkedHashMap<>();
        for (RouteClass rc : classes) {
            if (m.putIfAbsent(rc.name(), rc) != null) {
                throw new GovernanceConfigurationException("Route class declared twice: " + rc.name());
            }
        }
        if (m.isEmpty()) {
            throw new GovernanceConfigurationException("No route classes configured");
        }
        return new RouteClassRegistry(m);
    }

    public static RouteClassRegistry from(List<GovernanceProperties.RouteClassDef> defs) {
        return of(defs.stream()
                .map(d -> new RouteClass(d.getName().trim(), d.getAccess()))
                .toList());
    }

    public Optional<RouteClass> find(String name) {
        return Optional.ofNullable(name == null ? null : byName.get(name));
    }

    /** Lookup used while loading other tables; unknown names fail startup. */
    public RouteClass require(String name, String usedBy) {
        RouteClass rc = (name == null) ? null : byName.get(name.trim());
        if (rc == null) {
            throw new GovernanceConfigurationException(usedBy + " references undefined route class '" + name + "'");
        }
        return rc;
    }

    public Collection<RouteClass> all() {
        return byName.values();
    }
}
