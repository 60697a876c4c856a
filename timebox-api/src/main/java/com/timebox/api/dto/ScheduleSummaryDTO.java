package com.timebox.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.util.List;

/**
 * 排程汇总 DTO
 */
@Data
public class ScheduleSummaryDTO {

    private BigDecimal totalPlannedHours;
    private List<HoursBucket> byProject;
    private List<HoursBucket> byGenre;

    @Data
    public static class HoursBucket {
        private Long id;
        private String name;
        private BigDecimal hours;
    }
}
