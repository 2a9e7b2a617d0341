package net.schedora.bootstrap.catalog;

import net.schedora.bootstrap.props.SchedoraProperties;
import net.schedora.core.exception.ScheduleConcurrencyException;
import net.schedora.core.exception.ScheduleValidationException;
import net.schedora.core.model.RecurringType;
import net.schedora.core.model.Schedule;
import net.schedora.core.model.ScheduleDefinition;
import net.schedora.core.model.ScheduleDraft;
import net.schedora.core.service.ScheduleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.DayOfWeek;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CatalogRegistrarTest {

    ScheduleService service;
    CatalogRegistrar registrar;

    @BeforeEach
    void setUp() {
        service = mock(ScheduleService.class);
        registrar = new CatalogRegistrar(service, "Asia/Seoul");
    }

    static SchedoraProperties.ScheduleDef weeklyReport() {
        var d = new SchedoraProperties.ScheduleDef();
        d.setJobId(42L);
        d.setDescription("weekly-report");
        d.setType("recurring");
        d.setRecurringType("WEEKLY");
        d.setTimeOfDay("09:30");
        d.setDaysOfWeek(List.of(0, 4));
        d.setMaxExecutions(10);
        d.setEndDate("2026-01-01T00:00:00Z");
        return d;
    }

    static Schedule stored(long id, ScheduleDraft d) {
        return new Schedule(id, d.jobId(), d.definition(), d.timezone(), d.enabled(), 0, d.maxExecutions(),
                d.endDate(), Instant.parse("2025-01-06T00:30:00Z"), null, Schedule.Status.SCHEDULED, null,
                d.description(), null, 0, null, null, null, null);
    }

    @Test
    void toDraft_mapsRecurringFieldsAndDefaultZone() {
        ScheduleDraft draft = CatalogRegistrar.toDraft(weeklyReport(), "Asia/Seoul");

        assertThat(draft.jobId()).isEqualTo(42L);
        assertThat(draft.timezone()).isEqualTo("Asia/Seoul");
        assertThat(draft.maxExecutions()).isEqualTo(10);
        assertThat(draft.endDate()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        var r = (ScheduleDefinition.Recurring) draft.definition();
        assertThat(r.recurringType()).isEqualTo(RecurringType.WEEKLY);
        assertThat(r.timeOfDay()).isEqualTo("09:30");
        assertThat(r.daysOfWeek()).isEqualTo(EnumSet.of(DayOfWeek.MONDAY, DayOfWeek.FRIDAY));
    }

    @Test
    void toDraft_onceAndCron() {
        var once = new SchedoraProperties.ScheduleDef();
        once.setJobId(1L);
        once.setType("ONCE");
        once.setExecuteAt("2025-03-01T12:00:00Z");
        once.setTimezone("UTC");
        var cron = new SchedoraProperties.ScheduleDef();
        cron.setJobId(1L);
        cron.setType("CRON");
        cron.setCronExpression("*/5 * * * *");

        assertThat(CatalogRegistrar.toDraft(once, "Asia/Seoul").definition())
                .isEqualTo(new ScheduleDefinition.Once(Instant.parse("2025-03-01T12:00:00Z")));
        assertThat(CatalogRegistrar.toDraft(once, "Asia/Seoul").timezone()).isEqualTo("UTC");
        assertThat(CatalogRegistrar.toDraft(cron, "UTC").definition())
                .isEqualTo(new ScheduleDefinition.Cron("*/5 * * * *"));
    }

    @Test
    void toDraft_rejectsMalformedEntries() {
        var noType = weeklyReport();
        noType.setType(null);
        var badType = weeklyReport();
        badType.setType("HOURLY");
        var badInstant = weeklyReport();
        badInstant.setEndDate("tomorrow");
        var badDay = weeklyReport();
        badDay.setDaysOfWeek(List.of(7));
        var timeOnMinutes = weeklyReport();
        timeOnMinutes.setRecurringType("MINUTES");
        timeOnMinutes.setDaysOfWeek(List.of());

        for (var d : List.of(noType, badType, badInstant, badDay, timeOnMinutes)) {
            assertThatThrownBy(() -> CatalogRegistrar.toDraft(d, "UTC"))
                    .as(d.toString())
                    .isInstanceOf(ScheduleValidationException.class);
        }
    }

    @Test
    void register_createsMissingSchedule() throws Exception {
        when(service.listByJob(42L)).thenReturn(List.of());
        when(service.create(any())).thenAnswer(inv -> stored(7L, inv.getArgument(0)));
        var catalog = new SchedoraProperties.Catalog();
        catalog.setSchedules(List.of(weeklyReport()));

        registrar.register(catalog);

        ArgumentCaptor<ScheduleDraft> captor = ArgumentCaptor.forClass(ScheduleDraft.class);
        verify(service).create(captor.capture());
        assertThat(captor.getValue().description()).isEqualTo("weekly-report");
        verify(service, never()).update(anyLong(), any());
    }

    @Test
    void register_leavesIdenticalScheduleAlone() throws Exception {
        var existing = stored(7L, CatalogRegistrar.toDraft(weeklyReport(), "Asia/Seoul"));
        when(service.listByJob(42L)).thenReturn(List.of(existing));

        assertThat(registrar.upsert(weeklyReport())).isEqualTo(CatalogRegistrar.Outcome.UNCHANGED);

        verify(service, never()).create(any());
        verify(service, never()).update(anyLong(), any());
    }

    @Test
    void register_updatesChangedDefinitionInPlace() throws Exception {
        var existing = stored(7L, CatalogRegistrar.toDraft(weeklyReport(), "Asia/Seoul"));
        when(service.listByJob(42L)).thenReturn(List.of(existing));
        when(service.update(eq(7L), any())).thenAnswer(inv -> stored(7L, inv.getArgument(1)));
        var changed = weeklyReport();
        changed.setTimeOfDay("10:00");

        assertThat(registrar.upsert(changed)).isEqualTo(CatalogRegistrar.Outcome.UPDATED);

        verify(service).update(eq(7L), any());
        verify(service, never()).create(any());
    }

    @Test
    void register_defersUpdateWhileScheduleIsBeingFired() throws Exception {
        var existing = stored(7L, CatalogRegistrar.toDraft(weeklyReport(), "Asia/Seoul"));
        when(service.listByJob(42L)).thenReturn(List.of(existing));
        when(service.update(eq(7L), any())).thenThrow(new ScheduleConcurrencyException(7L, "leased"));
        var changed = weeklyReport();
        changed.setTimeOfDay("10:00");
        var catalog = new SchedoraProperties.Catalog();
        catalog.setSchedules(List.of(changed));

        assertThat(registrar.upsert(changed)).isEqualTo(CatalogRegistrar.Outcome.DEFERRED);
        registrar.register(catalog);   // 기동을 막지 않는다
    }

    @Test
    void register_matchesOnDescriptionWithinJob() throws Exception {
        var other = weeklyReport();
        other.setDescription("something-else");
        when(service.listByJob(42L))
                .thenReturn(List.of(stored(3L, CatalogRegistrar.toDraft(other, "Asia/Seoul"))));
        when(service.create(any())).thenAnswer(inv -> stored(8L, inv.getArgument(0)));

        assertThat(registrar.upsert(weeklyReport())).isEqualTo(CatalogRegistrar.Outcome.CREATED);
    }

    @Test
    void register_requiresJobIdAndDescription() {
        var d = weeklyReport();
        d.setJobId(null);

        assertThatThrownBy(() -> registrar.upsert(d)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(service);
    }
}
