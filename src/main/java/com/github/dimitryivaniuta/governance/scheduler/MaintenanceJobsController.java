package com.github.dimitryivaniuta.governance.scheduler;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only view of maintenance job records.
 */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/governance/jobs")
public class MaintenanceJobsController {

    private final MaintenanceScheduler scheduler;

    @GetMapping
    public List<JobRecord> jobs() {
        return scheduler.records();
    }
}
