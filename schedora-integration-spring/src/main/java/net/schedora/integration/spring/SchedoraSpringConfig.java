package net.schedora.integration.spring;

import net.schedora.adapter.jdbc.repo.JdbcScheduleExecutionRepository;
import net.schedora.adapter.jdbc.repo.JdbcScheduleRepository;
import net.schedora.core.spi.Clock;
import net.schedora.core.spi.ScheduleExecutionRepository;
import net.schedora.core.spi.ScheduleRepository;
import net.schedora.core.spi.TxRunner;
import net.schedora.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Instant;

@Configuration
public class SchedoraSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public ScheduleRepository scheduleRepository(DataSource ds) { return new JdbcScheduleRepository(ds); }
    @Bean public ScheduleExecutionRepository scheduleExecutionRepository(DataSource ds) {
        return new JdbcScheduleExecutionRepository(ds);
    }

    @Bean public Clock systemClock() { return Instant::now; }

    // CronCalculator, ScheduleEventSink 기본 구현은 bootstrap 자동 구성에서 (없을 때만)
}
