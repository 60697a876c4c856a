package com.timebox.trigger.job;

import com.timebox.domain.schedule.model.valobj.SchedulePreferences;
import com.timebox.trigger.application.command.WeeklyScheduleApplicationService;
import com.timebox.trigger.application.command.WeeklyScheduleApplicationService.WeeklyScheduleResult;
import com.timebox.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.Collections;

/**
 * 周排程定时任务：每周一早上为当周生成 AI 排程，失败只记日志。
 */
@Slf4j
@Component
public class WeeklyScheduleJob {

    private final WeeklyScheduleApplicationService weeklyScheduleApplicationService;
    private final boolean enabled;
    private final ZoneId zoneId;
    private final Counter failureCounter;

    public WeeklyScheduleJob(WeeklyScheduleApplicationService weeklyScheduleApplicationService,
                             @Value("${schedule.weekly-job.enabled:false}") boolean enabled,
                             @Value("${schedule.weekly-job.zone:Asia/Tokyo}") String zone) {
        this.weeklyScheduleApplicationService = weeklyScheduleApplicationService;
        this.enabled = enabled;
        this.zoneId = ZoneId.of(zone);
        this.failureCounter = Counter.builder("timebox.schedule.weekly-job.failure.total").register(Metrics.globalRegistry);
    }

    @Scheduled(cron = "${schedule.weekly-job.cron:0 0 6 * * MON}",
            zone = "${schedule.weekly-job.zone:Asia/Tokyo}",
            scheduler = "daemonScheduler")
    public void generateUpcomingWeek() {
        if (!enabled) {
            return;
        }
        runFor(LocalDate.now(zoneId));
    }

    /**
     * 为 today 所在或之后最近的周一生成排程，返回是否成功。
     */
    public boolean runFor(LocalDate today) {
        LocalDate weekStart = nextMonday(today);
        log.info("WEEKLY_JOB_START weekStart={}", weekStart);
        try {
            WeeklyScheduleResult result = weeklyScheduleApplicationService.generateWeekly(
                    weekStart, SchedulePreferences.defaults(), Collections.emptyList(), true);
            log.info("WEEKLY_JOB_DONE weekStart={}, blocks={}, plannedHours={}",
                    weekStart, result.schedules().size(), result.summary().totalPlannedHours());
            for (String warning : result.warnings()) {
                log.warn("WEEKLY_JOB_WARNING weekStart={}, warning={}", weekStart, warning);
            }
            return true;
        } catch (AppException ex) {
            failureCounter.increment();
            log.error("WEEKLY_JOB_FAILED weekStart={}, errorCode={}, errorMessage={}",
                    weekStart, ex.getCode(), ex.getInfo());
            return false;
        } catch (RuntimeException ex) {
            failureCounter.increment();
            log.error("WEEKLY_JOB_FAILED weekStart={}, errorType={}, errorMessage={}",
                    weekStart, ex.getClass().getSimpleName(), ex.getMessage(), ex);
            return false;
        }
    }

    static LocalDate nextMonday(LocalDate today) {
        return today.with(TemporalAdjusters.nextOrSame(DayOfWeek.MONDAY));
    }
}
