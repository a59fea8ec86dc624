package com.flagship.group_access.jobs;

import com.flagship.group_access.reconciliation.ReconciliationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual and cron-driven job triggers. A run already in progress answers 409.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
@Slf4j
public class JobsController {

    private final JobCoordinator coordinator;

    @PostMapping("/reconciliation")
    public ReconciliationResult runReconciliation() {
        log.info("Reconciliation run requested");
        return coordinator.runReconciliation();
    }

    @PostMapping("/sweep")
    public SweepResult runSweep() {
        log.info("Lifecycle sweep requested");
        return coordinator.runSweep();
    }
}
