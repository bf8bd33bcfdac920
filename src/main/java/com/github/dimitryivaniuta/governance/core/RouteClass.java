package com.github.dimitryivaniuta.governance.core;

import java.util.Objects;

/**
 * Static label shared by endpoints with identical authorization and quota policy.
 */
public record RouteClass(String name, RouteAccess access) {

    public RouteClass {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(access, "access must not be null");
    }

    public boolean isPublic() {
        return access == RouteAccess.PUBLIC;
    }
}
