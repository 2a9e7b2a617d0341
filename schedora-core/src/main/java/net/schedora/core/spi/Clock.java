package net.schedora.core.spi;

import java.time.Instant;

/** 현재 시각 공급자. 테스트에서 고정 시각 주입 */
@FunctionalInterface
public interface Clock {
    Instant now();

    static Clock fixed(Instant instant) { return () -> instant; }
}
