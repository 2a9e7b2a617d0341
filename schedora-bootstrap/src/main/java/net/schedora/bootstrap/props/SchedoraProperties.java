package net.schedora.bootstrap.props;

import net.schedora.core.service.MonthlyOverflowPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties("schedora")
public class SchedoraProperties {
    private Catalog catalog = new Catalog();
    /** 카탈로그 스케줄의 기본 timezone */
    private String zone = "UTC";
    private Scheduler scheduler = new Scheduler();

    public Catalog getCatalog() {
        return catalog;
    }

    public void setCatalog(Catalog catalog) {
        this.catalog = catalog;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public static class Catalog {
        private boolean enabled = true;
        private List<ScheduleDef> schedules = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<ScheduleDef> getSchedules() {
            return schedules;
        }

        public void setSchedules(List<ScheduleDef> schedules) {
            this.schedules = schedules;
        }
    }

    /** 설정 파일로 선언하는 스케줄. (jobId, description) 이 멱등 등록 키 */
    public static class ScheduleDef {
        private Long jobId;
        private String description;
        private String type;               // ONCE | RECURRING | CRON
        private String executeAt;          // ISO-8601 instant
        private String recurringType;      // MINUTES | HOURS | DAILY | WEEKLY | MONTHLY
        private int interval = 1;
        private String timeOfDay;          // HH:MM
        private List<Integer> daysOfWeek = new ArrayList<>();   // 월=0 .. 일=6
        private Integer dayOfMonth;
        private String cronExpression;
        private String timezone;
        private Integer maxExecutions;
        private String endDate;            // ISO-8601 instant
        private boolean enabled = true;

        public Long getJobId() {
            return jobId;
        }

        public void setJobId(Long jobId) {
            this.jobId = jobId;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public String getExecuteAt() {
            return executeAt;
        }

        public void setExecuteAt(String executeAt) {
            this.executeAt = executeAt;
        }

        public String getRecurringType() {
            return recurringType;
        }

        public void setRecurringType(String recurringType) {
            this.recurringType = recurringType;
        }

        public int getInterval() {
            return interval;
        }

        public void setInterval(int interval) {
            this.interval = interval;
        }

        public String getTimeOfDay() {
            return timeOfDay;
        }

        public void setTimeOfDay(String timeOfDay) {
            this.timeOfDay = timeOfDay;
        }

        public List<Integer> getDaysOfWeek() {
            return daysOfWeek;
        }

        public void setDaysOfWeek(List<Integer> daysOfWeek) {
            this.daysOfWeek = daysOfWeek;
        }

        public Integer getDayOfMonth() {
            return dayOfMonth;
        }

        public void setDayOfMonth(Integer dayOfMonth) {
            this.dayOfMonth = dayOfMonth;
        }

        public String getCronExpression() {
            return cronExpression;
        }

        public void setCronExpression(String cronExpression) {
            this.cronExpression = cronExpression;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public Integer getMaxExecutions() {
            return maxExecutions;
        }

        public void setMaxExecutions(Integer maxExecutions) {
            this.maxExecutions = maxExecutions;
        }

        public String getEndDate() {
            return endDate;
        }

        public void setEndDate(String endDate) {
            this.endDate = endDate;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        @Override
        public String toString() {
            return "ScheduleDef{" +
                    "jobId=" + jobId +
                    ", description='" + description + '\'' +
                    ", type='" + type + '\'' +
                    ", recurringType='" + recurringType + '\'' +
                    ", cronExpression='" + cronExpression + '\'' +
                    ", enabled=" + enabled +
                    '}';
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private long tickDelayMs = 1000;
        private long maintenanceDelayMs = 60000;
        private Duration claimLease = Duration.ofSeconds(30);
        /** 비우면 host/pid 기반으로 생성 */
        private String owner;
        private Duration executionRetention = Duration.ofDays(30);
        /** 0 이면 디스패처를 틱 스레드에서 직접 호출 */
        private int dispatchThreads = 4;
        private int dispatchQueueCapacity = 1000;
        private int batchLimit = 500;
        private MonthlyOverflowPolicy monthlyOverflow = MonthlyOverflowPolicy.CLAMP;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickDelayMs() {
            return tickDelayMs;
        }

        public void setTickDelayMs(long tickDelayMs) {
            this.tickDelayMs = tickDelayMs;
        }

        public long getMaintenanceDelayMs() {
            return maintenanceDelayMs;
        }

        public void setMaintenanceDelayMs(long maintenanceDelayMs) {
            this.maintenanceDelayMs = maintenanceDelayMs;
        }

        public Duration getClaimLease() {
            return claimLease;
        }

        public void setClaimLease(Duration claimLease) {
            this.claimLease = claimLease;
        }

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public Duration getExecutionRetention() {
            return executionRetention;
        }

        public void setExecutionRetention(Duration executionRetention) {
            this.executionRetention = executionRetention;
        }

        public int getDispatchThreads() {
            return dispatchThreads;
        }

        public void setDispatchThreads(int dispatchThreads) {
            this.dispatchThreads = dispatchThreads;
        }

        public int getDispatchQueueCapacity() {
            return dispatchQueueCapacity;
        }

        public void setDispatchQueueCapacity(int dispatchQueueCapacity) {
            this.dispatchQueueCapacity = dispatchQueueCapacity;
        }

        public int getBatchLimit() {
            return batchLimit;
        }

        public void setBatchLimit(int batchLimit) {
            this.batchLimit = batchLimit;
        }

        public MonthlyOverflowPolicy getMonthlyOverflow() {
            return monthlyOverflow;
        }

        public void setMonthlyOverflow(MonthlyOverflowPolicy monthlyOverflow) {
            this.monthlyOverflow = monthlyOverflow;
        }
    }
}
