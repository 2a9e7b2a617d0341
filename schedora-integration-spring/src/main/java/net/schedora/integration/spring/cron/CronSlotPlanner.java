package net.schedora.integration.spring.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/** cron-utils 기반 5필드(UNIX) cron 평가. 파싱 결과는 LRU 캐시 */
public final class CronSlotPlanner {
    private static final CronParser PARSER =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    // 간단 LRU(최대 256개)
    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronSlotPlanner() {}

    /** from 보다 엄격히 뒤인 다음 실행 시각. 잘못된 표현식이면 IllegalArgumentException */
    public static Optional<Instant> nextAfter(String cronExpr, ZoneId zone, Instant from) {
        Objects.requireNonNull(cronExpr); Objects.requireNonNull(zone); Objects.requireNonNull(from);

        ExecutionTime et = executionTime(cronExpr);
        ZonedDateTime base = from.atZone(zone);
        Optional<ZonedDateTime> next = et.nextExecution(base);
        // 기준 시각이 정확히 슬롯에 걸린 경우 대비
        if (next.isPresent() && !next.get().toInstant().isAfter(from)) {
            next = et.nextExecution(next.get().plusSeconds(1));
        }
        return next.map(ZonedDateTime::toInstant);
    }

    /** 문법 + 필드 범위 검사 */
    public static void validate(String cronExpr) {
        Objects.requireNonNull(cronExpr);
        parse(cronExpr);
    }

    public static void invalidate(String expr) { synchronized (CACHE) { CACHE.remove(expr.trim()); } }
    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    private static ExecutionTime executionTime(String cronExpr) {
        String key = cronExpr.trim();
        synchronized (CACHE) {
            ExecutionTime cached = CACHE.get(key);
            if (cached != null) return cached;
        }
        ExecutionTime et = ExecutionTime.forCron(parse(key));
        synchronized (CACHE) {
            CACHE.put(key, et);
        }
        return et;
    }

    private static Cron parse(String cronExpr) {
        // cron-utils 는 문법 오류를 IllegalArgumentException 으로 던진다
        return PARSER.parse(cronExpr.trim()).validate();
    }

    // --- 내부 LRU ---
    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
