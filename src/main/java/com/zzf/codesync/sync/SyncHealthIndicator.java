package com.zzf.codesync.sync;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component("sync")
@RequiredArgsConstructor
public class SyncHealthIndicator implements HealthIndicator {

    private final SyncOrchestrator orchestrator;

    @Override
    public Health health() {
        SyncSnapshot snapshot = orchestrator.snapshot();
        return Health.up()
                .withDetail("state", snapshot.getState())
                .withDetail("version", snapshot.getBuffer().getVersion())
                .withDetail("trackedLines", orchestrator.getTracker().size())
                .build();
    }
}
