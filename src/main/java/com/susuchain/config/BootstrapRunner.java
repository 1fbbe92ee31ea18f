package com.susuchain.config;

import com.susuchain.domain.model.BootstrapReport;
import com.susuchain.domain.service.BootstrapOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs the bootstrap once at startup when app.bootstrap.run-on-startup is set.
 * A failed enumeration is logged and does not stop the application.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "app.bootstrap.run-on-startup", havingValue = "true")
public class BootstrapRunner implements ApplicationRunner {

    private final BootstrapOrchestrator orchestrator;

    @Override
    public void run(ApplicationArguments args) {
        try {
            BootstrapReport report = orchestrator.run();
            if (report.count(BootstrapReport.Outcome.FAILED) > 0) {
                log.warn("Startup bootstrap finished with {} failed groups", report.count(BootstrapReport.Outcome.FAILED));
            }
        } catch (Exception e) {
            log.error("Startup bootstrap aborted: {}", e.getMessage(), e);
        }
    }
}
