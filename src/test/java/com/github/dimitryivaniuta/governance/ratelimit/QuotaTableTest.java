package com.github.dimitryivaniuta.governance.ratelimit;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.core.GovernanceConfigurationException;
import com.github.dimitryivaniuta.governance.core.Role;
import com.github.dimitryivaniuta.governance.route.RouteClassRegistry;
import com.github.dimitryivaniuta.governance.support.GovernanceFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.github.dimitryivaniuta.governance.support.GovernanceFixtures.limit;
import static com.github.dimitryivaniuta.governance.support.GovernanceFixtures.quota;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuotaTableTest {

    private RouteClassRegistry registry;
    private QuotaTable table;

    @BeforeEach
    void setUp() {
        GovernanceProperties p = GovernanceFixtures.defaults();
        registry = RouteClassRegistry.from(p.getRouteClasses());
        table = QuotaTable.from(p.getQuotas(), registry);
    }

    @Test
    void shouldUseDefaultPolicyValues() {
        assertThat(table.limitsFor("public", Role.ANONYMOUS)).containsExactly(QuotaLimit.perMinute(30));
        assertThat(table.limitsFor("public", Role.ADMIN)).containsExactly(QuotaLimit.perMinute(30));
        assertThat(table.limitsFor("auth", Role.ANONYMOUS)).containsExactly(QuotaLimit.perMinute(3), QuotaLimit.perHour(9));
        assertThat(table.limitsFor("admin-write", Role.ADMIN)).containsExactly(QuotaLimit.perMinute(60));
        assertThat(table.limitsFor("manager-write", Role.MANAGER)).containsExactly(QuotaLimit.perMinute(40));
        assertThat(table.limitsFor("user-read", Role.USER)).containsExactly(QuotaLimit.perMinute(20));
        assertThat(table.limitsFor("user-read", Role.ANONYMOUS)).containsExactly(QuotaLimit.perMinute(10));
    }

    @Test
    void shouldPreferExactRuleOverRouteClassAndRole() {
        GovernanceProperties p = GovernanceFixtures.defaults();
        List<GovernanceProperties.QuotaDef> defs = new ArrayList<>(p.getQuotas());
        defs.add(quota("public", Role.ADMIN, limit(100, Duration.ofMinutes(1))));

        QuotaTable t = QuotaTable.from(defs, registry);

        assertThat(t.limitsFor("public", Role.ADMIN)).containsExactly(QuotaLimit.perMinute(100));
        assertThat(t.limitsFor("public", Role.USER)).containsExactly(QuotaLimit.perMinute(30));
    }

    @Test
    void shouldBeUnlimitedWithoutMatchingRule() {
        QuotaTable t = QuotaTable.from(List.of(quota("public", null, limit(5, Duration.ofSeconds(10)))), registry);

        assertThat(t.limitsFor("admin-read", Role.ADMIN)).isEmpty();
    }

    @Test
    void shouldRejectDuplicateAndInvalidRules() {
        assertThatThrownBy(() -> QuotaTable.from(List.of(
                quota(null, Role.USER, limit(1, Duration.ofMinutes(1))),
                quota(null, Role.USER, limit(2, Duration.ofMinutes(1)))), registry))
                .isInstanceOf(GovernanceConfigurationException.class)
                .hasMessageContaining("declared twice");

        assertThatThrownBy(() -> QuotaTable.from(List.of(
                quota("public", null, limit(5, Duration.ZERO))), registry))
                .isInstanceOf(GovernanceConfigurationException.class);

        assertThatThrownBy(() -> QuotaTable.from(List.of(
                quota(null, null, limit(5, Duration.ofMinutes(1)))), registry))
                .isInstanceOf(GovernanceConfigurationException.class);

        assertThatThrownBy(() -> QuotaTable.from(List.of(
                quota("reports", null, limit(5, Duration.ofMinutes(1)))), registry))
                .isInstanceOf(GovernanceConfigurationException.class)
                .hasMessageContaining("reports");
    }
}
