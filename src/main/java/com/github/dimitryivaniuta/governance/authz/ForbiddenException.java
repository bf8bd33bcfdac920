package com.github.dimitryivaniuta.governance.authz;

import com.github.dimitryivaniuta.governance.core.Role;

public class ForbiddenException extends RuntimeException {

    private final Role role;
    private final String routeClass;

    public ForbiddenException(Role role, String routeClass, String method) {
        super(role + " is not permitted to " + method + " on route class '" + routeClass + "'");
        this.role = role;
        this.routeClass = routeClass;
    }

    public Role getRole() {
        return role;
    }

    public String getRouteClass() {
        return routeClass;
    }
}
