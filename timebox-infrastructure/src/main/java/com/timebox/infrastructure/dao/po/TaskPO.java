package com.timebox.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * 任务 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPO {

    private Long id;
    private String name;
    private Long projectId;
    private Long genreId;
    private String status;
    private LocalDate deadline;
    private BigDecimal estimatedHours;
    private String priority;
    private String wantLevel;
    private Boolean isSplittable;
    private BigDecimal minWorkUnit;
    private Long parentTaskId;
    private Integer decompositionLevel;
    private String note;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
