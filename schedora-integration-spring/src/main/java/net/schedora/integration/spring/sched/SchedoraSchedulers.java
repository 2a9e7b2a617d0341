package net.schedora.integration.spring.sched;

import net.schedora.core.maintenance.MaintenanceService;
import net.schedora.core.service.SchedulingLoop;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Duration;

public class SchedoraSchedulers {
    private final SchedulingLoop loop;
    private final MaintenanceService maintenance;

    private Duration executionRetention = Duration.ofDays(30);

    public SchedoraSchedulers(SchedulingLoop loop, MaintenanceService maintenance) {
        this.loop = loop;
        this.maintenance = maintenance;
    }

    @Scheduled(fixedDelayString = "${schedora.scheduler.tick-delay-ms:1000}")
    public void tick() throws Exception {
        loop.tick();
    }

    @Scheduled(fixedDelayString = "${schedora.scheduler.maintenance-delay-ms:60000}")
    public void maintenance() throws Exception {
        maintenance.runOnce(executionRetention);
    }

    public void setExecutionRetention(Duration executionRetention) {
        this.executionRetention = executionRetention;
    }
}
