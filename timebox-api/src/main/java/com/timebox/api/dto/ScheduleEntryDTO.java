package com.timebox.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 生成的排程块 DTO
 */
@Data
public class ScheduleEntryDTO {

    private Long id;
    private Long taskId;
    private String taskName;
    private String projectName;
    private String genreName;
    private LocalDate date;

    /**
     * HH:mm，可为空
     */
    private String startTime;

    /**
     * HH:mm，可为空
     */
    private String endTime;

    private BigDecimal allocatedHours;
    private Boolean generatedByAi;
    private String reasoning;
}
