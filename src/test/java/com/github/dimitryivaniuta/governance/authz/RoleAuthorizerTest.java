package com.github.dimitryivaniuta.governance.authz;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.core.GovernanceConfigurationException;
import com.github.dimitryivaniuta.governance.core.Role;
import com.github.dimitryivaniuta.governance.route.RouteClassRegistry;
import com.github.dimitryivaniuta.governance.support.GovernanceFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.github.dimitryivaniuta.governance.support.GovernanceFixtures.permission;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleAuthorizerTest {

    private RouteClassRegistry registry;
    private RoleAuthorizer authorizer;

    @BeforeEach
    void setUp() {
        GovernanceProperties p = GovernanceFixtures.defaults();
        registry = RouteClassRegistry.from(p.getRouteClasses());
        authorizer = new RoleAuthorizer(PermissionTable.from(p.getPermissions(), registry), registry);
    }

    @Test
    void shouldFollowDefaultRoleMatrix() {
        assertThat(authorizer.isPermitted(Role.ADMIN, "admin-write", "DELETE")).isTrue();
        assertThat(authorizer.isPermitted(Role.MANAGER, "manager-write", "POST")).isTrue();
        assertThat(authorizer.isPermitted(Role.MANAGER, "admin-read", "GET")).isFalse();
        assertThat(authorizer.isPermitted(Role.USER, "user-write", "PATCH")).isTrue();
        assertThat(authorizer.isPermitted(Role.USER, "manager-write", "POST")).isFalse();
        assertThat(authorizer.isPermitted(Role.USER, "public", "GET")).isTrue();
    }

    @Test
    void anonymousShouldOnlyReachPublicClasses() {
        assertThat(authorizer.isPermitted(Role.ANONYMOUS, "public", "GET")).isTrue();
        assertThat(authorizer.isPermitted(Role.ANONYMOUS, "auth", "POST")).isTrue();
        assertThat(authorizer.isPermitted(Role.ANONYMOUS, "user-read", "GET")).isFalse();
        assertThat(authorizer.isPermitted(Role.ANONYMOUS, "admin-read", "GET")).isFalse();
    }

    @Test
    void shouldDenyUnknownRouteClass() {
        assertThat(authorizer.isPermitted(Role.ADMIN, "no-such-class", "GET")).isFalse();
        assertThat(authorizer.isPermitted(Role.ADMIN, null, "GET")).isFalse();
    }

    @Test
    void shouldRestrictToListedMethods() {
        GovernanceProperties p = GovernanceFixtures.defaults();
        GovernanceProperties.PermissionDef readOnly = permission(Role.USER, "public");
        readOnly.setMethods(new ArrayList<>(List.of("get", "HEAD")));
        p.setPermissions(new ArrayList<>(List.of(readOnly)));

        RoleAuthorizer a = new RoleAuthorizer(PermissionTable.from(p.getPermissions(), registry), registry);

        assertThat(a.isPermitted(Role.USER, "public", "GET")).isTrue();
        assertThat(a.isPermitted(Role.USER, "public", "head")).isTrue();
        assertThat(a.isPermitted(Role.USER, "public", "POST")).isFalse();
    }

    @Test
    void authorize_shouldThrowForbidden() {
        assertThatThrownBy(() -> authorizer.authorize(Role.USER, "admin-write", "DELETE"))
                .isInstanceOfSatisfying(ForbiddenException.class, ex -> {
                    assertThat(ex.getRole()).isEqualTo(Role.USER);
                    assertThat(ex.getRouteClass()).isEqualTo("admin-write");
                });
    }

    @Test
    void table_shouldRejectAnonymousOnAuthenticatedClass() {
        List<GovernanceProperties.PermissionDef> defs = List.of(permission(Role.ANONYMOUS, "public", "user-read"));

        assertThatThrownBy(() -> PermissionTable.from(defs, registry))
                .isInstanceOf(GovernanceConfigurationException.class)
                .hasMessageContaining("user-read");
    }

    @Test
    void table_shouldRejectDuplicateRule() {
        List<GovernanceProperties.PermissionDef> defs = List.of(
                permission(Role.USER, "public"),
                permission(Role.USER, "user-read", "public"));

        assertThatThrownBy(() -> PermissionTable.from(defs, registry))
                .isInstanceOf(GovernanceConfigurationException.class)
                .hasMessageContaining("declared twice");
    }

    @Test
    void table_shouldRejectUndefinedRouteClass() {
        List<GovernanceProperties.PermissionDef> defs = List.of(permission(Role.ADMIN, "reports"));

        assertThatThrownBy(() -> PermissionTable.from(defs, registry))
                .isInstanceOf(GovernanceConfigurationException.class)
                .hasMessageContaining("reports");
    }
}
