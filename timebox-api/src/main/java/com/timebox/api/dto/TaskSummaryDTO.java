package com.timebox.api.dto;

import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 任务摘要 DTO
 */
@Data
public class TaskSummaryDTO {

    private Long id;
    private String name;
    private String status;
    private Long projectId;
    private Long genreId;
    private Long parentTaskId;
    private Integer decompositionLevel;
    private BigDecimal estimatedHours;
    private LocalDate deadline;
}
