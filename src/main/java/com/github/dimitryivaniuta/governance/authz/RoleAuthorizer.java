package com.github.dimitryivaniuta.governance.authz;

import com.github.dimitryivaniuta.governance.core.Role;
import com.github.dimitryivaniuta.governance.core.RouteClass;
import com.github.dimitryivaniuta.governance.route.RouteClassRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a role may call a route class with a given method.
 * Deny-by-absence: anything not granted by the permission table is forbidden.
 */
@Service
@RequiredArgsConstructor
public class RoleAuthorizer {

    private final PermissionTable permissions;
    private final RouteClassRegistry routeClasses;

    public boolean isPermitted(Role role, String routeClass, String method) {
        if (role == null || routeClass == null) return false;

        Optional<RouteClass> rc = routeClasses.find(routeClass);
        if (rc.isEmpty()) return false;
        if (role.isAnonymous() && !rc.get().isPublic()) return false;

        Set<String> allowed = permissions.lookup(role, routeClass);
        if (allowed == null) return false;
        return allowed.isEmpty() || (method != null && allowed.contains(method.toUpperCase(Locale.ROOT)));
    }

    /**
     * @throws ForbiddenException when the call is not permitted
     */
    public void authorize(Role role, String routeClass, String method) {
        if (!isPermitted(role, routeClass, method)) {
            throw new ForbiddenException(role, routeClass, method);
        }
    }
}
