package com.timebox.api.dto;

import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * 周排程生成响应 DTO
 */
@Data
public class WeeklyScheduleResponseDTO {

    private LocalDate weekStart;
    private LocalDate weekEnd;
    private List<ScheduleEntryDTO> schedules;
    private ScheduleSummaryDTO summary;
    private List<String> warnings;
}
