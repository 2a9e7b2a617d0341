package net.schedora.core.spi;

import java.time.Instant;
import java.time.ZoneId;

public interface CronCalculator {
    /** from 보다 엄격히 뒤인 다음 슬롯. 없으면 null */
    Instant next(Instant from, String cronExpr, ZoneId zone);

    /** 문법 검사. 잘못된 표현식이면 IllegalArgumentException */
    void validate(String cronExpr);
}
