package com.github.dimitryivaniuta.governance.config;

import com.github.dimitryivaniuta.governance.authz.PermissionTable;
import com.github.dimitryivaniuta.governance.ratelimit.QuotaTable;
import com.github.dimitryivaniuta.governance.route.RouteClassRegistry;
import com.github.dimitryivaniuta.governance.route.RouteTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the immutable governance tables from {@link GovernanceProperties}.
 * Any conflict or dangling reference fails context startup.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(GovernanceProperties.class)
public class GovernancePolicyConfig {

    @Bean
    public RouteClassRegistry routeClassRegistry(GovernanceProperties props) {
        return RouteClassRegistry.from(props.getRouteClasses());
    }

    @Bean
    public RouteTable routeTable(GovernanceProperties props, RouteClassRegistry registry) {
        RouteTable table = RouteTable.from(props.getRoutes(), registry);
        log.info("Route table loaded: {} bindings over {} route classes", table.bindings().size(), registry.all().size());
        return table;
    }

    @Bean
    public PermissionTable permissionTable(GovernanceProperties props, RouteClassRegistry registry) {
        return PermissionTable.from(props.getPermissions(), registry);
    }

    @Bean
    public QuotaTable quotaTable(GovernanceProperties props, RouteClassRegistry registry) {
        return QuotaTable.from(props.getQuotas(), registry);
    }
}
