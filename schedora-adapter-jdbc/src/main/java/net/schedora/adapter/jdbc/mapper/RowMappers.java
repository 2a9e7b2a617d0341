package net.schedora.adapter.jdbc.mapper;

import net.schedora.core.model.ExecutionRecord;
import net.schedora.core.model.RecurringType;
import net.schedora.core.model.Schedule;
import net.schedora.core.model.ScheduleDefinition;
import net.schedora.core.model.ScheduleType;
import net.schedora.core.model.Weekdays;

import java.sql.ResultSet;
import java.sql.SQLException;

import static net.schedora.adapter.jdbc.JdbcUtil.getInstant;
import static net.schedora.adapter.jdbc.JdbcUtil.getNullableInt;
import static net.schedora.adapter.jdbc.JdbcUtil.getNullableLong;

public final class RowMappers {
    private RowMappers() {}

    // --- Schedule ---
    public static Schedule toSchedule(ResultSet rs) throws SQLException {
        return new Schedule(
                rs.getLong("ID"),
                rs.getLong("JOB_ID"),
                toDefinition(rs),
                rs.getString("TIMEZONE"),
                "Y".equals(rs.getString("ENABLED")),
                rs.getInt("EXECUTION_COUNT"),
                getNullableInt(rs, "MAX_EXECUTIONS"),
                getInstant(rs, "END_DATE"),
                getInstant(rs, "NEXT_RUN"),
                getInstant(rs, "LAST_RUN"),
                Schedule.Status.from(rs.getString("STATUS")),
                rs.getString("LAST_ERROR"),
                rs.getString("DESCRIPTION"),
                getNullableLong(rs, "CREATED_BY"),
                rs.getLong("VERSION"),
                rs.getString("LEASE_OWNER"),
                getInstant(rs, "LEASE_UNTIL"),
                getInstant(rs, "CREATED_AT"),
                getInstant(rs, "UPDATED_AT")
        );
    }

    static ScheduleDefinition toDefinition(ResultSet rs) throws SQLException {
        ScheduleType type = ScheduleType.from(rs.getString("SCHEDULE_TYPE"));
        return switch (type) {
            case ONCE -> new ScheduleDefinition.Once(getInstant(rs, "EXECUTE_AT"));
            case CRON -> new ScheduleDefinition.Cron(rs.getString("CRON_EXPR"));
            case RECURRING -> new ScheduleDefinition.Recurring(
                    RecurringType.from(rs.getString("RECURRING_TYPE")),
                    rs.getInt("INTERVAL_VALUE"),
                    rs.getString("TIME_OF_DAY"),
                    Weekdays.parse(rs.getString("DAYS_OF_WEEK")),
                    getNullableInt(rs, "DAY_OF_MONTH"));
        };
    }

    // --- ExecutionRecord ---
    public static ExecutionRecord toExecutionRecord(ResultSet rs) throws SQLException {
        return new ExecutionRecord(
                rs.getLong("ID"),
                rs.getLong("SCHEDULE_ID"),
                getInstant(rs, "SCHEDULED_AT"),
                getInstant(rs, "STARTED_AT"),
                ExecutionRecord.Status.from(rs.getString("STATUS")),
                rs.getString("DISPATCH_REF"),
                getInstant(rs, "CREATED_AT")
        );
    }
}
