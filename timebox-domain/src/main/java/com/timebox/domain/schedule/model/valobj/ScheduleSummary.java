package com.timebox.domain.schedule.model.valobj;

import java.math.BigDecimal;
import java.util.List;

/**
 * 排程汇总：总计划工时及按项目、按类别的分布。
 */
public record ScheduleSummary(BigDecimal totalPlannedHours,
                              List<HoursBucket> byProject,
                              List<HoursBucket> byGenre) {

    public static ScheduleSummary empty() {
        return new ScheduleSummary(BigDecimal.ZERO, List.of(), List.of());
    }

    /**
     * 单个分组的工时，id 为空表示未归属分组。
     */
    public record HoursBucket(Long id, String name, BigDecimal hours) {
    }
}
