package com.timebox.domain.schedule.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * 周排程偏好：按星期的可用工时、单任务单日上限、是否减少上下文切换与重点项目。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulePreferences {

    /** 未配置某一天时使用的可用工时 */
    public static final BigDecimal FALLBACK_DAILY_HOURS = new BigDecimal("6");

    private Map<DayOfWeek, BigDecimal> dailyHours;

    private BigDecimal maxHoursPerTaskPerDay;

    private boolean avoidContextSwitch;

    private Long focusProjectId;

    /**
     * 默认偏好：工作日 6 小时、周末不排、单任务单日最多 4 小时、减少上下文切换。
     */
    public static SchedulePreferences defaults() {
        Map<DayOfWeek, BigDecimal> hours = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : DayOfWeek.values()) {
            boolean weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
            hours.put(day, weekend ? BigDecimal.ZERO : FALLBACK_DAILY_HOURS);
        }
        return SchedulePreferences.builder()
                .dailyHours(hours)
                .maxHoursPerTaskPerDay(new BigDecimal("4"))
                .avoidContextSwitch(true)
                .build();
    }

    public BigDecimal capacityOf(LocalDate date) {
        return capacityOf(date.getDayOfWeek());
    }

    public BigDecimal capacityOf(DayOfWeek day) {
        if (dailyHours == null) {
            return FALLBACK_DAILY_HOURS;
        }
        BigDecimal hours = dailyHours.get(day);
        return hours == null ? FALLBACK_DAILY_HOURS : hours;
    }
}
