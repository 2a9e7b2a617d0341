package net.schedora.bootstrap.autoconfigure;

import net.schedora.bootstrap.catalog.CatalogRegistrar;
import net.schedora.bootstrap.props.SchedoraProperties;
import net.schedora.core.maintenance.MaintenanceService;
import net.schedora.core.service.*;
import net.schedora.core.spi.*;
import net.schedora.integration.spring.SchedoraSpringConfig;
import net.schedora.integration.spring.audit.Slf4jScheduleEventSink;
import net.schedora.integration.spring.cron.CronUtilsCalculator;
import net.schedora.integration.spring.sched.SchedoraSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.lang.management.ManagementFactory;
import java.util.UUID;

@AutoConfiguration
@EnableConfigurationProperties(SchedoraProperties.class)
@Import(SchedoraSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class SchedoraAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(SchedoraAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    @Bean
    @ConditionalOnMissingBean(ScheduleEventSink.class)
    public ScheduleEventSink scheduleEventSink() {
        return new Slf4jScheduleEventSink();
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public ScheduleCalculator scheduleCalculator(CronCalculator cron, SchedoraProperties props) {
        return new ScheduleCalculator(cron, props.getScheduler().getMonthlyOverflow());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleValidator scheduleValidator(CronCalculator cron) {
        return new ScheduleValidator(cron);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleService scheduleService(ScheduleRepository schedules,
                                           ScheduleExecutionRepository executions,
                                           ScheduleCalculator calculator,
                                           ScheduleValidator validator,
                                           TxRunner tx,
                                           Clock clock,
                                           ScheduleEventSink events) {
        return new ScheduleService(schedules, executions, calculator, validator, tx, clock, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public DueScheduleFinder dueScheduleFinder(ScheduleRepository schedules, TxRunner tx, SchedoraProperties props) {
        return new DueScheduleFinder(schedules, tx, props.getScheduler().getBatchLimit());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionTracker executionTracker(ScheduleRepository schedules,
                                             ScheduleExecutionRepository executions,
                                             ScheduleCalculator calculator,
                                             TxRunner tx,
                                             ScheduleEventSink events) {
        return new ExecutionTracker(schedules, executions, calculator, tx, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenance(ScheduleRepository schedules,
                                          ScheduleExecutionRepository executions,
                                          TxRunner tx,
                                          Clock clock) {
        return new MaintenanceService(schedules, executions, tx, clock);
    }

    // --- 발화 루프: 애플리케이션이 JobDispatcher 를 등록했을 때만 ---

    @Bean(name = "schedoraDispatchExecutor")
    @ConditionalOnBean(JobDispatcher.class)
    @ConditionalOnExpression("${schedora.scheduler.dispatch-threads:4} > 0")
    public ThreadPoolTaskExecutor schedoraDispatchExecutor(SchedoraProperties props) {
        var s = props.getScheduler();
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(s.getDispatchThreads());
        executor.setMaxPoolSize(s.getDispatchThreads());
        executor.setQueueCapacity(s.getDispatchQueueCapacity());
        executor.setThreadNamePrefix("schedora-dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JobDispatcher.class)
    public SchedulingLoop schedulingLoop(DueScheduleFinder finder,
                                         ExecutionTracker tracker,
                                         ScheduleRepository schedules,
                                         JobDispatcher dispatcher,
                                         ObjectProvider<ThreadPoolTaskExecutor> dispatchExecutor,
                                         TxRunner tx,
                                         Clock clock,
                                         SchedoraProperties props) {
        var s = props.getScheduler();
        JobDispatcher effective = dispatcher;
        ThreadPoolTaskExecutor executor = dispatchExecutor.getIfAvailable();
        if (executor != null) {
            effective = new AsyncJobDispatcher(dispatcher, executor);
        }
        String owner = s.getOwner() == null || s.getOwner().isBlank() ? defaultOwner() : s.getOwner();
        log.info("Scheduling loop owner={}, claimLease={}, batchLimit={}, async={}",
                owner, s.getClaimLease(), s.getBatchLimit(), executor != null);
        return new SchedulingLoop(finder, tracker, schedules, effective, tx, clock, owner, s.getClaimLease());
    }

    // --- 스케줄러 등록 (프로퍼티로 주기 제어) ---

    @Bean
    @ConditionalOnBean(SchedulingLoop.class)
    @ConditionalOnProperty(prefix = "schedora.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    public SchedoraSchedulers schedoraSchedulers(SchedulingLoop loop,
                                                 MaintenanceService maintenance,
                                                 SchedoraProperties props) {
        var s = new SchedoraSchedulers(loop, maintenance);
        // @Scheduled 딜레이는 schedora.scheduler.tick-delay-ms / maintenance-delay-ms 에서 직접 읽힘
        s.setExecutionRetention(props.getScheduler().getExecutionRetention());
        return s;
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "schedora.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    @EnableScheduling
    static class SchedulingEnabler {
    }

    // --- 설정 카탈로그 ---

    @Bean
    @ConditionalOnMissingBean
    public CatalogRegistrar catalogRegistrar(ScheduleService schedules, SchedoraProperties props) {
        return new CatalogRegistrar(schedules, props.getZone());
    }

    @Bean
    @ConditionalOnProperty(prefix = "schedora.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner schedoraCatalogRunner(CatalogRegistrar registrar, SchedoraProperties props) {
        return args -> registrar.register(props.getCatalog());
    }

    static String defaultOwner() {
        try {
            return ManagementFactory.getRuntimeMXBean().getName(); // pid@host
        } catch (RuntimeException e) {
            return "schedora-" + UUID.randomUUID();
        }
    }
}
