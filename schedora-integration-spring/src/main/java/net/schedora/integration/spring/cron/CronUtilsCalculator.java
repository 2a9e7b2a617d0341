package net.schedora.integration.spring.cron;

import net.schedora.core.spi.CronCalculator;

import java.time.Instant;
import java.time.ZoneId;

/** 코어 SPI 구현체 */
public final class CronUtilsCalculator implements CronCalculator {
    @Override
    public Instant next(Instant from, String cronExpr, ZoneId zone) {
        return CronSlotPlanner.nextAfter(cronExpr, zone, from).orElse(null);
    }

    @Override
    public void validate(String cronExpr) {
        CronSlotPlanner.validate(cronExpr);
    }
}
