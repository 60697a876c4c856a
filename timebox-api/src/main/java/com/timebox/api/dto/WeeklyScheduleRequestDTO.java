package com.timebox.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * 周排程生成请求 DTO
 */
@Data
public class WeeklyScheduleRequestDTO {

    /**
     * 周一日期
     */
    private LocalDate weekStart;

    private Preferences preferences;

    private List<FixedEvent> fixedEvents;

    /**
     * 是否清除本周已有的 AI 排程，默认 true
     */
    private Boolean clearExisting;

    @Data
    public static class Preferences {
        private DailyHours dailyHours;
        private BigDecimal maxHoursPerTaskPerDay;
        private Boolean avoidContextSwitch;
        private Long focusProjectId;
    }

    @Data
    public static class DailyHours {
        private BigDecimal mon;
        private BigDecimal tue;
        private BigDecimal wed;
        private BigDecimal thu;
        private BigDecimal fri;
        private BigDecimal sat;
        private BigDecimal sun;
    }

    @Data
    public static class FixedEvent {
        private LocalDate date;
        private String startTime;
        private String endTime;
        private String title;
    }
}
