package com.timebox.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * 排程块 PO。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleBlockPO {

    private Long id;
    private Long taskId;
    private LocalDate scheduledDate;
    private LocalTime startTime;
    private LocalTime endTime;
    private BigDecimal allocatedHours;
    private Boolean isGeneratedByAi;
    private String status;
    private LocalDateTime createdAt;
}
