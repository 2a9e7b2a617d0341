package net.schedora.bootstrap.catalog;

import net.schedora.bootstrap.props.SchedoraProperties;
import net.schedora.core.exception.ScheduleConcurrencyException;
import net.schedora.core.exception.ScheduleValidationException;
import net.schedora.core.model.RecurringType;
import net.schedora.core.model.Schedule;
import net.schedora.core.model.ScheduleDefinition;
import net.schedora.core.model.ScheduleDraft;
import net.schedora.core.model.ScheduleType;
import net.schedora.core.model.Weekdays;
import net.schedora.core.service.ScheduleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * 설정에 선언된 스케줄을 기동 시 등록. (jobId, description) 으로 기존 행을 찾아
 * 정의가 같으면 그대로 두고, 다르면 update, 없으면 create.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final ScheduleService schedules;
    private final String defaultZone;

    public CatalogRegistrar(ScheduleService schedules, String defaultZone) {
        this.schedules = schedules;
        this.defaultZone = defaultZone;
    }

    public void register(SchedoraProperties.Catalog catalog) throws Exception {
        int created = 0, updated = 0, deferred = 0;
        for (var def : catalog.getSchedules()) {
            switch (upsert(def)) {
                case CREATED -> created++;
                case UPDATED -> updated++;
                case DEFERRED -> deferred++;
                case UNCHANGED -> { }
            }
        }
        log.info("Catalog registered: {} schedule(s), created={}, updated={}, deferred={}",
                catalog.getSchedules().size(), created, updated, deferred);
    }

    enum Outcome { CREATED, UPDATED, UNCHANGED, DEFERRED }

    Outcome upsert(SchedoraProperties.ScheduleDef def) throws Exception {
        if (def.getJobId() == null || def.getDescription() == null || def.getDescription().isBlank()) {
            throw new IllegalArgumentException("catalog schedule requires jobId and description: " + def);
        }
        ScheduleDraft draft = toDraft(def, defaultZone);

        Optional<Schedule> existing = schedules.listByJob(draft.jobId()).stream()
                .filter(s -> draft.description().equals(s.description()))
                .findFirst();

        if (existing.isEmpty()) {
            Schedule s = schedules.create(draft);
            log.info("Catalog schedule '{}' created for job {}: id={}, nextRun={}",
                    draft.description(), draft.jobId(), s.id(), s.nextRun());
            return Outcome.CREATED;
        }
        Schedule current = existing.get();
        if (sameDefinition(current, draft)) {
            log.debug("Catalog schedule '{}' unchanged (id={})", draft.description(), current.id());
            return Outcome.UNCHANGED;
        }
        Schedule s;
        try {
            s = schedules.update(current.id(), draft);
        } catch (ScheduleConcurrencyException e) {
            // 다른 인스턴스가 지금 발화 중. 다음 기동 때 반영
            log.warn("Catalog schedule '{}' (id={}) not updated: {}", draft.description(), current.id(), e.getMessage());
            return Outcome.DEFERRED;
        }
        log.info("Catalog schedule '{}' updated: id={}, nextRun={}", draft.description(), s.id(), s.nextRun());
        return Outcome.UPDATED;
    }

    static ScheduleDraft toDraft(SchedoraProperties.ScheduleDef def, String defaultZone) {
        if (def.getType() == null) {
            throw new ScheduleValidationException("catalog schedule '" + def.getDescription() + "' has no type");
        }
        ScheduleType type;
        try {
            type = ScheduleType.from(def.getType());
        } catch (IllegalArgumentException e) {
            throw new ScheduleValidationException("unknown schedule type '" + def.getType() + "'", e);
        }

        ScheduleDefinition definition = switch (type) {
            case ONCE -> new ScheduleDefinition.Once(instant(def.getExecuteAt(), "executeAt"));
            case CRON -> new ScheduleDefinition.Cron(def.getCronExpression());
            case RECURRING -> recurring(def);
        };
        String zone = def.getTimezone() != null ? def.getTimezone() : defaultZone;
        return new ScheduleDraft(def.getJobId(), definition, zone, def.isEnabled(), def.getMaxExecutions(),
                instant(def.getEndDate(), "endDate"), def.getDescription(), null);
    }

    private static ScheduleDefinition.Recurring recurring(SchedoraProperties.ScheduleDef def) {
        RecurringType rt;
        try {
            rt = RecurringType.from(def.getRecurringType());
        } catch (IllegalArgumentException e) {
            throw new ScheduleValidationException("unknown recurring type '" + def.getRecurringType() + "'", e);
        }
        try {
            return new ScheduleDefinition.Recurring(rt, def.getInterval(), def.getTimeOfDay(),
                    Weekdays.fromIndices(def.getDaysOfWeek()),
                    def.getDayOfMonth());
        } catch (IllegalArgumentException e) {
            // 요일 인덱스 범위 밖
            throw new ScheduleValidationException(e.getMessage(), e);
        }
    }

    private static Instant instant(String text, String field) {
        if (text == null || text.isBlank()) return null;
        try {
            return Instant.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new ScheduleValidationException(field + " must be an ISO-8601 instant: '" + text + "'", e);
        }
    }

    private static boolean sameDefinition(Schedule s, ScheduleDraft d) {
        return s.definition().equals(d.definition())
                && s.timezone().equals(d.timezone() == null ? Schedule.DEFAULT_TIMEZONE : d.timezone())
                && Objects.equals(s.maxExecutions(), d.maxExecutions())
                && Objects.equals(s.endDate(), d.endDate())
                && (s.enabled() == d.enabled() || s.status().isTerminal() && s.status() != Schedule.Status.DISABLED);
    }
}
