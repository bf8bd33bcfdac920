package com.github.dimitryivaniuta.governance.scheduler;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;

/**
 * Cron triggers for the maintenance jobs. Runs on the Spring scheduling pool,
 * never on a request thread.
 */
@Slf4j
@Component
public class MaintenanceTriggers {

    private final MaintenanceScheduler scheduler;
    private final GovernanceProperties properties;
    private final Executor maintenanceExecutor;

    public MaintenanceTriggers(MaintenanceScheduler scheduler,
                               GovernanceProperties properties,
                               @Qualifier("maintenanceExecutor") Executor maintenanceExecutor) {
        this.scheduler = scheduler;
        this.properties = properties;
        this.maintenanceExecutor = maintenanceExecutor;
    }

    @Scheduled(cron = "${governance.scheduler.event-deactivation.cron:0 0 0 * * *}",
            zone = "${governance.scheduler.zone:Asia/Jerusalem}")
    public void deactivatePastEvents() {
        scheduler.run(EventDeactivationJob.NAME);
    }

    @Scheduled(cron = "${governance.scheduler.stale-account-purge.cron:0 0 0 * * *}",
            zone = "${governance.scheduler.zone:Asia/Jerusalem}")
    public void purgeStaleAccounts() {
        scheduler.run(StaleAccountPurgeJob.NAME);
    }

    /**
     * Catches up on firings missed while the service was down. The jobs are idempotent,
     * so an extra run after a firing that did happen is harmless.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void catchUpOnStartup() {
        if (!properties.getScheduler().isRunOnStartup()) return;
        log.info("Running maintenance jobs once after startup");
        maintenanceExecutor.execute(scheduler::runAll);
    }
}
